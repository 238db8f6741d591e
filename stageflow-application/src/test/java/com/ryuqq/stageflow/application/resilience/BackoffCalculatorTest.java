package com.ryuqq.stageflow.application.resilience;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 유닛 테스트.
 *
 * @author Stageflow Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 지터_없이_지수_증가_후_상한() {
        BackoffCalculator calculator = new BackoffCalculator(200, 2000, 0.0);

        assertThat(calculator.calculate(1)).isEqualTo(200);
        assertThat(calculator.calculate(2)).isEqualTo(400);
        assertThat(calculator.calculate(3)).isEqualTo(800);
        assertThat(calculator.calculate(4)).isEqualTo(1600);
        assertThat(calculator.calculate(5)).isEqualTo(2000);
        assertThat(calculator.calculate(100)).isEqualTo(2000);
    }

    @Test
    void 지터는_지연을_늘리되_상한을_넘지_않음() {
        BackoffCalculator calculator = new BackoffCalculator(1000, 1050, 0.1);

        for (int i = 0; i < 50; i++) {
            assertThat(calculator.calculate(1)).isBetween(1000L, 1050L);
            assertThat(calculator.calculate(2)).isEqualTo(1050L);
        }
    }

    @Test
    void 큰_기본_지연도_오버플로_없이_상한() {
        BackoffCalculator calculator = new BackoffCalculator(Long.MAX_VALUE / 4, Long.MAX_VALUE / 2, 0.0);

        assertThat(calculator.calculate(40)).isEqualTo(Long.MAX_VALUE / 2);
    }

    @Test
    void 잘못된_설정과_시도_번호_거부() {
        BackoffCalculator calculator = new BackoffCalculator(100, 1000, 0.1);

        assertThatThrownBy(() -> calculator.calculate(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(0, 1000, 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(500, 100, 0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 1000, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
