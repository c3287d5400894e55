package de.zeiterfassung.api_gleitzeit.service.interval;

import de.zeiterfassung.api_gleitzeit.entity.timeStamp.TimeStamp;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Läuft lazy über eine nach Datum und Uhrzeit sortierte Stempelliste.
 * Zwei aufeinanderfolgende Stempel desselben Tages ergeben ein Paar,
 * sonst wird der einzelne Stempel übersprungen und der nächste versucht.
 */
public final class StampPairing implements Iterable<StampPairing.Step> {

    public record Step(TimeStamp first, TimeStamp second) {

        public boolean paired() {
            return second != null;
        }
    }

    private final List<TimeStamp> stamps;

    private StampPairing(List<TimeStamp> stamps) {
        this.stamps = stamps;
    }

    public static StampPairing of(List<TimeStamp> sortedStamps) {
        return new StampPairing(sortedStamps == null ? List.of() : sortedStamps);
    }

    @Override
    public Iterator<Step> iterator() {
        return new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index < stamps.size();
            }

            @Override
            public Step next() {
                if (!hasNext()) throw new NoSuchElementException();
                TimeStamp current = stamps.get(index);
                if (index + 1 < stamps.size()
                        && stamps.get(index + 1).getStampDate().equals(current.getStampDate())) {
                    TimeStamp next = stamps.get(index + 1);
                    index += 2;
                    return new Step(current, next);
                }
                index += 1;
                return new Step(current, null);
            }
        };
    }
}
