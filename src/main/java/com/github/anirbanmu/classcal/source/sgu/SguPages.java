package com.github.anirbanmu.classcal.source.sgu;

import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.SemesterOptions;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

// html extraction for the SGU timetable page (ASP.NET webforms)
final class SguPages {
    static final String SEMESTER_SELECT = "ctl00_ContentPlaceHolder1_ctl00_ddlChonNHHK";

    private SguPages() {
    }

    static SemesterOptions semesterOptions(String html) {
        Document doc = Jsoup.parse(html);
        List<String> semesters = new ArrayList<>();
        Element select = doc.getElementById(SEMESTER_SELECT);
        if (select != null) {
            for (Element option : select.select("option")) {
                semesters.add(option.attr("value"));
            }
        }
        return new SemesterOptions(semesters, List.of());
    }

    static String viewState(String html) {
        Element input = Jsoup.parse(html).getElementById("__VIEWSTATE");
        return input == null ? null : input.attr("value");
    }

    static List<RawRecord> scheduleRows(String html) {
        Document doc = Jsoup.parse(html);
        List<RawRecord> rows = new ArrayList<>();
        for (Element tr : doc.select("tr[height=22px]")) {
            List<String> cells = new ArrayList<>();
            for (Element td : tr.select("td")) {
                cells.add(td.text());
            }
            rows.add(new RawRecord(cells));
        }
        return rows;
    }
}
