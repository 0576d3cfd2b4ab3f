package com.friendpick.backend.modules.question.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * 하루 두 번(openTime1, openTime2) 열리는 발행 스케줄.
 * openTime1 에 열린 세트는 같은 날 openTime2 에 닫히고, 그 외에는 다음 날 openTime1 에 닫힌다.
 */
public final class PublishSchedule {

    private final LocalTime openTime1;
    private final LocalTime openTime2;
    private final ZoneId zone;

    public PublishSchedule(LocalTime openTime1, LocalTime openTime2, ZoneId zone) {
        this.openTime1 = Objects.requireNonNull(openTime1, "openTime1");
        this.openTime2 = Objects.requireNonNull(openTime2, "openTime2");
        this.zone = Objects.requireNonNull(zone, "zone");
        if (!openTime1.isBefore(openTime2)) {
            throw new IllegalArgumentException("openTime1 must be before openTime2");
        }
    }

    /**
     * The first slot strictly after {@code now}.
     */
    public OffsetDateTime nextOpening(OffsetDateTime now) {
        ZonedDateTime local = now.atZoneSameInstant(zone);
        LocalTime time = local.toLocalTime();
        LocalDate today = local.toLocalDate();
        if (time.isBefore(openTime1)) {
            return at(today, openTime1);
        }
        if (time.isBefore(openTime2)) {
            return at(today, openTime2);
        }
        return at(today.plusDays(1), openTime1);
    }

    public OffsetDateTime closingOf(OffsetDateTime publishedAt) {
        ZonedDateTime local = publishedAt.atZoneSameInstant(zone);
        // DST 전환 구간에서는 openTime1 이 다른 시각으로 밀리므로 해석된 슬롯 시점과 비교한다
        if (publishedAt.isEqual(at(local.toLocalDate(), openTime1))) {
            return at(local.toLocalDate(), openTime2);
        }
        return at(local.toLocalDate().plusDays(1), openTime1);
    }

    /**
     * Window following {@code previous}: starts exactly at its end. Without a previous set the next slot after now
     * is used.
     */
    public PublishWindow windowAfter(QuestionSet previous, OffsetDateTime now) {
        OffsetDateTime publishedAt = previous != null ? previous.getEndAt() : nextOpening(now);
        return new PublishWindow(publishedAt, closingOf(publishedAt));
    }

    private OffsetDateTime at(LocalDate date, LocalTime time) {
        return date.atTime(time).atZone(zone).toOffsetDateTime();
    }
}
