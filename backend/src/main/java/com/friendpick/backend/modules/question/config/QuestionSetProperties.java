package com.friendpick.backend.modules.question.config;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalTime;
import java.time.ZoneId;

import com.friendpick.backend.modules.question.domain.PublishSchedule;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

/**
 * app.question-set.* 설정.
 *
 * @param size        number of questions per set
 * @param friendRatio share of FRIEND questions, rounded down
 * @param openTime1   first daily publish slot
 * @param openTime2   second daily publish slot, after openTime1
 * @param zone        zone the slots are expressed in
 */
@Validated
@ConfigurationProperties(prefix = "app.question-set")
public record QuestionSetProperties(
        @Min(1) int size,
        @DecimalMin("0.0") @DecimalMax("1.0") double friendRatio,
        @NotNull @DateTimeFormat(pattern = "HH:mm") LocalTime openTime1,
        @NotNull @DateTimeFormat(pattern = "HH:mm") LocalTime openTime2,
        @NotNull ZoneId zone
) {

    public int friendQuestionCount() {
        // double 곱셈은 29.0 이 28.999... 로 내려갈 수 있어 십진수로 계산한다
        return BigDecimal.valueOf(friendRatio)
                .multiply(BigDecimal.valueOf(size))
                .setScale(0, RoundingMode.FLOOR)
                .intValueExact();
    }

    public int accompanyQuestionCount() {
        return size - friendQuestionCount();
    }

    public PublishSchedule toSchedule() {
        return new PublishSchedule(openTime1, openTime2, zone);
    }
}
