package de.zeiterfassung.api_gleitzeit.service.employee;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TrafficLightTest {

    @Test
    void evaluate_usesGreenAndRedBoundaries() {
        assertThat(TrafficLight.evaluate(0.0, 0.0, -5.0)).isEqualTo(TrafficLight.GREEN);
        assertThat(TrafficLight.evaluate(12.5, 0.0, -5.0)).isEqualTo(TrafficLight.GREEN);
        assertThat(TrafficLight.evaluate(-0.25, 0.0, -5.0)).isEqualTo(TrafficLight.YELLOW);
        assertThat(TrafficLight.evaluate(-5.0, 0.0, -5.0)).isEqualTo(TrafficLight.RED);
        assertThat(TrafficLight.evaluate(-8.0, 0.0, -5.0)).isEqualTo(TrafficLight.RED);
    }
}
