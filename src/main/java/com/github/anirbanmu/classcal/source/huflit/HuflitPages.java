package com.github.anirbanmu.classcal.source.huflit;

import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.SemesterOptions;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

// html extraction for the HUFLIT portal pages
final class HuflitPages {
    // title rows above the header, then the header itself
    private static final int LEADING_ROWS = 2;
    private static final int HEADER_ROWS = 2;

    private HuflitPages() {
    }

    static SemesterOptions semesterOptions(String html) {
        Document doc = Jsoup.parse(html);
        return new SemesterOptions(optionValues(doc, "select#TermID"), optionValues(doc, "select#YearStudy"));
    }

    static Result scheduleRows(String html) {
        Document doc = Jsoup.parse(html);
        List<RawRecord> rows = new ArrayList<>();
        for (Element tr : doc.select("tr")) {
            List<String> cells = new ArrayList<>();
            for (Element td : tr.select("td")) {
                cells.add(td.text());
            }
            rows.add(new RawRecord(cells));
        }

        if (rows.size() <= LEADING_ROWS) {
            return new Result(List.of(), null);
        }
        rows = rows.subList(LEADING_ROWS, rows.size());

        // a lone row is the portal's "no timetable yet" notice
        if (rows.size() == 1) {
            return new Result(List.of(), rows.get(0).cell(0));
        }
        if (rows.size() <= HEADER_ROWS) {
            return new Result(List.of(), null);
        }
        return new Result(List.copyOf(rows.subList(HEADER_ROWS, rows.size())), null);
    }

    private static List<String> optionValues(Document doc, String selectQuery) {
        Element select = doc.selectFirst(selectQuery);
        if (select == null) {
            return List.of();
        }
        Elements options = select.select("option");
        List<String> values = new ArrayList<>(options.size());
        for (Element option : options) {
            values.add(option.attr("value"));
        }
        return values;
    }

    record Result(List<RawRecord> rows, String notice) {
    }
}
