package com.elssolution.modemmonitor.events;

import com.elssolution.modemmonitor.domain.EventLogEntry;
import com.elssolution.modemmonitor.domain.EventPriority;
import com.elssolution.modemmonitor.domain.Watermark;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WatermarkDeduplicatorTest {

    private final WatermarkDeduplicator dedup = new WatermarkDeduplicator();

    static EventLogEntry ev(long index, String time) {
        return new EventLogEntry(index, time, "82000200", EventPriority.CRITICAL, "No Ranging Response received - T3 time-out");
    }

    static Watermark mark(String time, long index) {
        return new Watermark(LocalDateTime.parse(time, EventLogEntry.DEVICE_TIME), index);
    }

    @Test
    void cold_start_reports_newest_event_only() {
        List<EventLogEntry> batch = List.of(
                ev(3, "03/05/24 14:02:11"),
                ev(2, "03/05/24 13:00:00"),
                ev(1, "03/04/24 09:12:45"));

        DedupResult r = dedup.advance(batch, DedupState.coldStart());

        assertThat(r.newEvents()).containsExactly(batch.get(0));
        assertThat(r.next().watermark()).isEqualTo(mark("03/05/24 14:02:11", 3));
    }

    @Test
    void reports_only_events_newer_than_watermark() {
        EventLogEntry e9 = ev(9, "01/02/24 10:00:09");
        EventLogEntry e8 = ev(8, "01/02/24 10:00:08");

        DedupResult r = dedup.advance(List.of(e9, e8),
                DedupState.fromWatermark(mark("01/02/24 10:00:08", 8)));

        assertThat(r.newEvents()).containsExactly(e9);
        assertThat(r.next().watermark()).isEqualTo(mark("01/02/24 10:00:09", 9));
    }

    @Test
    void nothing_new_keeps_watermark_at_device_newest() {
        EventLogEntry e5 = ev(5, "01/02/24 10:00:05");

        DedupResult r = dedup.advance(List.of(e5, ev(4, "01/02/24 10:00:04")),
                DedupState.fromWatermark(mark("01/02/24 10:00:05", 5)));

        assertThat(r.newEvents()).isEmpty();
        assertThat(r.next().watermark()).isEqualTo(mark("01/02/24 10:00:05", 5));
    }

    @Test
    void same_second_events_are_ordered_by_index() {
        EventLogEntry e12 = ev(12, "01/02/24 10:00:00");
        EventLogEntry e11 = ev(11, "01/02/24 10:00:00");

        DedupResult r = dedup.advance(List.of(e12, e11),
                DedupState.fromWatermark(mark("01/02/24 10:00:00", 11)));

        assertThat(r.newEvents()).containsExactly(e12);
    }

    @Test
    void device_clock_going_back_does_not_regress_watermark() {
        Watermark stored = mark("06/01/24 12:00:00", 40);

        DedupResult r = dedup.advance(List.of(ev(2, "01/01/00 00:00:10"), ev(1, "01/01/00 00:00:05")),
                DedupState.fromWatermark(stored));

        assertThat(r.newEvents()).isEmpty();
        assertThat(r.next().watermark()).isEqualTo(stored);
    }

    @Test
    void unparseable_timestamps_are_dropped_and_counted() {
        EventLogEntry good = ev(7, "01/02/24 10:00:07");
        EventLogEntry bad = ev(8, "Time Not Established");

        DedupResult r = dedup.advance(List.of(bad, good),
                DedupState.fromWatermark(mark("01/02/24 10:00:00", 1)));

        assertThat(r.newEvents()).containsExactly(good);
        assertThat(r.unparseable()).isEqualTo(1);
        assertThat(r.next().watermark()).isEqualTo(mark("01/02/24 10:00:07", 7));
    }

    @Test
    void empty_batch_leaves_state_untouched() {
        DedupState state = DedupState.fromWatermark(mark("01/02/24 10:00:00", 1));

        DedupResult r = dedup.advance(List.of(), state);

        assertThat(r.newEvents()).isEmpty();
        assertThat(r.next()).isEqualTo(state);
    }

    @Test
    void consecutive_polls_never_report_an_event_twice() {
        EventLogEntry e1 = ev(1, "01/02/24 10:00:01");
        EventLogEntry e2 = ev(2, "01/02/24 10:00:02");
        EventLogEntry e3 = ev(3, "01/02/24 10:00:03");

        DedupResult first = dedup.advance(List.of(e1), DedupState.coldStart());
        DedupResult second = dedup.advance(List.of(e3, e2, e1), first.next());
        DedupResult third = dedup.advance(List.of(e3, e2, e1), second.next());

        assertThat(first.newEvents()).containsExactly(e1);
        assertThat(second.newEvents()).containsExactly(e3, e2);
        assertThat(third.newEvents()).isEmpty();
    }
}
