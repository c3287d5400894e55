package de.zeiterfassung.api_gleitzeit.service.notification;

import de.zeiterfassung.api_gleitzeit.dto.notification.NotificationView;
import de.zeiterfassung.api_gleitzeit.entity.notification.Notification;
import de.zeiterfassung.api_gleitzeit.entity.notification.NotificationCode;
import de.zeiterfassung.api_gleitzeit.service.common.TimeService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

@Component
@RequiredArgsConstructor
public class NotificationTextRenderer {

    private final TimeService timeService;

    public String render(Notification notification) {
        return render(notification.getCode(), notification.getNotificationDate());
    }

    public NotificationView view(Notification notification) {
        return new NotificationView(notification.getId(),
                notification.getCode().getCode(),
                notification.getCode().name(),
                notification.getNotificationDate(),
                render(notification),
                notification.isPopup(),
                notification.getPopupTime());
    }

    public String render(NotificationCode code, LocalDate date) {
        String d = timeService.formatDate(date);
        return switch (code) {
            case MISSING_WORKDAY -> "An dem Tag " + d
                    + " wurde nicht gestempelt. Die tägliche Arbeitszeit wurde von der Gleitzeit abgezogen.";
            case ODD_STAMP_COUNT -> "Am " + d + " fehlt ein Stempel, bitte tragen Sie diesen nach.";
            case REST_PERIOD -> "Achtung, am " + d + " wurden die gesetzlichen Ruhezeiten nicht eingehalten.";
            case SIX_MONTH_AVERAGE -> "Achtung, Ihre durchschnittliche tägliche Arbeitszeit der letzten 6 Monate "
                    + "hat 8 Stunden überschritten.";
            case DAILY_MAXIMUM -> "Achtung, am " + d
                    + " wurde die maximale gesetzlich zulässige Arbeitszeit überschritten.";
            case SUNDAY_OR_HOLIDAY -> "Achtung, am " + d + " wurde an einem Sonn- oder Feiertag gearbeitet.";
            case MINOR_WEEKLY_HOURS -> "In der Woche vom " + d
                    + " wurde die maximale Wochenarbeitszeit von 40 Stunden für Minderjährige überschritten.";
            case MINOR_WORKDAYS -> "In der Woche vom " + d
                    + " wurde an mehr als 5 Tagen gearbeitet, was für Minderjährige nicht zulässig ist.";
            case WORK_WINDOW_ENDING -> "Ihr erlaubtes Arbeitsfenster endet bald.";
            case MAX_HOURS_APPROACHING -> "Sie erreichen bald die maximale tägliche Arbeitszeit.";
        };
    }
}
