package com.github.anirbanmu.classcal.calendar;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.classcal.schedule.Descriptor;
import com.github.anirbanmu.classcal.schedule.EventFormatter;
import com.github.anirbanmu.classcal.schedule.FormattedEvent;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubmissionBridgeTest {
    private static final ZoneId SAIGON = ZoneId.of("Asia/Ho_Chi_Minh");

    private final RecordingSink sink = new RecordingSink();
    private final SubmissionBridge bridge = new SubmissionBridge(sink, SAIGON, 30);

    private static FormattedEvent weekly() {
        Descriptor d = new Descriptor("841020", "Lập trình Java", "4", "DCT1201", "C.A101", "Nguyễn Văn A", "Hai", 1, 3, "1234567890",
            LocalDateTime.of(2023, 9, 4, 7, 0), LocalDateTime.of(2023, 11, 13, 8, 40));
        return EventFormatter.format(List.of(d)).events().get(0);
    }

    private static FormattedEvent exam() {
        Descriptor d = new Descriptor(null, "Thi cuối kỳ", null, null, "Hội trường", null, "Hai", 1, 3, "",
            LocalDateTime.of(2024, 1, 15, 7, 0), LocalDateTime.of(2024, 1, 15, 8, 40));
        return EventFormatter.format(List.of(d)).events().get(0);
    }

    @Test
    void testWeeklyPayload() {
        EventPayload p = bridge.toPayload(weekly());

        assertEquals("841020 Lập trình Java", p.summary());
        assertEquals("C.A101", p.location());
        assertEquals("Class: DCT1201\nLecturer: Nguyễn Văn A", p.description());
        assertEquals(ZonedDateTime.of(2023, 9, 4, 7, 0, 0, 0, SAIGON), p.start());
        assertEquals(ZonedDateTime.of(2023, 9, 4, 8, 40, 0, 0, SAIGON), p.end());
        assertEquals(10, p.weeklyCount());
        assertEquals("RRULE:FREQ=WEEKLY;COUNT=10", p.recurrenceRule());
        assertEquals(1, p.colorId());
        assertEquals(30, p.reminderMinutes());
    }

    @Test
    void testSingleDayPayloadHasNoRecurrence() {
        EventPayload p = bridge.toPayload(exam());

        assertEquals("Thi cuối kỳ", p.summary());
        assertEquals("Class: \nLecturer: ", p.description());
        assertFalse(p.recurring());
        assertNull(p.recurrenceRule());
    }

    @Test
    void testColorIdWrapsIntoPalette() {
        assertEquals(1, SubmissionBridge.colorId(1));
        assertEquals(11, SubmissionBridge.colorId(11));
        assertEquals(1, SubmissionBridge.colorId(12));
        assertEquals(3, SubmissionBridge.colorId(25));
    }

    @Test
    void testSubmitInsertsAllEventsInOrder() {
        bridge.createCalendar("Class Schedule");

        int count = bridge.submit("Class Schedule", List.of(weekly(), exam()));

        assertEquals(2, count);
        List<EventPayload> stored = sink.calendars.get("Class Schedule");
        assertEquals(List.of("841020 Lập trình Java", "Thi cuối kỳ"), stored.stream().map(EventPayload::summary).toList());
    }

    @Test
    void testLifecycleDelegates() {
        bridge.createCalendar("A");
        assertTrue(bridge.exists("A"));

        bridge.renameCalendar("A", "B");
        assertFalse(bridge.exists("A"));
        assertTrue(bridge.exists("B"));

        bridge.deleteCalendar("B");
        assertFalse(bridge.exists("B"));
        assertEquals(List.of("create A", "rename A B", "delete B"), sink.calls);
    }

    @Test
    void testSinkErrorsPropagate() {
        CalendarSinkException e = assertThrows(CalendarSinkException.class, () -> bridge.submit("Missing", List.of(weekly())));
        assertTrue(e.getMessage().contains("create a calendar first"));
    }
}
