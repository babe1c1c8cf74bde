package com.github.anirbanmu.classcal.source.sgu;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.classcal.config.ConfigLoader;
import com.github.anirbanmu.classcal.schedule.Descriptor;
import com.github.anirbanmu.classcal.schedule.ScheduleLookupException;
import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.SemesterSelection;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class SguAdapterTest {
    private static final SemesterSelection FALL_2023 = SemesterSelection.of("20231");

    private final SguAdapter adapter = new SguAdapter(ConfigLoader.defaults().source("sgu").orElseThrow().tables());

    private static RawRecord row(String weekday, String startSlot, String lessons, String lecturer, String pattern) {
        return RawRecord.of("841020", "Lập trình Java", "01", "4", "DCT1201, DCT1202", "", "", "",
            weekday, startSlot, lessons, "C.A101", lecturer, pattern);
    }

    @Test
    void testStandardizeMondayMorning() {
        Descriptor d = adapter.standardize(FALL_2023, row("Hai", "1", "2", "Nguyễn Văn A", "1234567890"));

        assertEquals("841020", d.code());
        assertEquals("Lập trình Java", d.name());
        assertEquals("4", d.credits());
        assertEquals("DCT1201", d.classSection());
        assertEquals("C.A101", d.room());
        assertEquals("Nguyễn Văn A", d.lecturer());
        assertEquals(1, d.startPeriod());
        assertEquals(3, d.endPeriod());
        assertEquals(LocalDateTime.of(2023, 9, 4, 7, 0), d.fromDate());
        assertEquals(LocalDateTime.of(2023, 11, 13, 8, 40), d.toDate());
    }

    @Test
    void testSkippedWeeksAndAfternoonSlot() {
        Descriptor d = adapter.standardize(FALL_2023, row("Tư", "6", "3", "Trần B", "--12345"));

        assertEquals(9, d.endPeriod());
        assertEquals("--12345", d.weekPattern());
        assertEquals(LocalDateTime.of(2023, 9, 20, 13, 0), d.fromDate());
        assertEquals(LocalDateTime.of(2023, 11, 8, 15, 30), d.toDate());
    }

    @Test
    void testBlankLecturerLeftForFormatter() {
        Descriptor d = adapter.standardize(FALL_2023, row("Ba", "1", "2", "  ", "12"));

        assertNull(d.lecturer());
    }

    @Test
    void testUnknownWeekdayFailsBatchWithRowNumber() {
        List<RawRecord> rows = List.of(
            row("Hai", "1", "2", "A", "1"),
            row("CN", "1", "2", "A", "1"));

        ScheduleLookupException e = assertThrows(ScheduleLookupException.class, () -> adapter.standardize(FALL_2023, rows));
        assertTrue(e.getMessage().startsWith("row 2:"), e.getMessage());
        assertTrue(e.getMessage().contains("'CN'"), e.getMessage());
    }

    @Test
    void testUnknownSemester() {
        assertThrows(ScheduleLookupException.class,
            () -> adapter.standardize(SemesterSelection.of("20301"), row("Hai", "1", "2", "A", "1")));
    }

    @Test
    void testLessonsPastLastSlot() {
        // slots 12, 13 exist but 14 does not
        assertThrows(ScheduleLookupException.class, () -> adapter.standardize(FALL_2023, row("Hai", "12", "3", "A", "1")));
        assertDoesNotThrow(() -> adapter.standardize(FALL_2023, row("Hai", "12", "2", "A", "1")));
    }

    @Test
    void testNonNumericSlot() {
        ScheduleLookupException e = assertThrows(ScheduleLookupException.class,
            () -> adapter.standardize(FALL_2023, row("Hai", "x", "2", "A", "1")));
        assertTrue(e.getMessage().contains("start_period"));
    }

    @Test
    void testZeroLessons() {
        assertThrows(ScheduleLookupException.class, () -> adapter.standardize(FALL_2023, row("Hai", "1", "0", "A", "1")));
    }

    @Test
    void testMissingWeekPattern() {
        assertThrows(ScheduleLookupException.class, () -> adapter.standardize(FALL_2023, row("Hai", "1", "2", "A", "")));
    }

    @Test
    void testClassSection() {
        assertEquals("DCT1201", SguAdapter.classSection("DCT1201, DCT1202, DCT1203"));
        assertEquals("DCT1201", SguAdapter.classSection("DCT1201"));
        assertNull(SguAdapter.classSection(null));
    }
}
