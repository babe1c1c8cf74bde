package com.github.anirbanmu.classcal.calendar.google;

import com.github.anirbanmu.classcal.calendar.CalendarSink;
import com.github.anirbanmu.classcal.calendar.CalendarSinkException;
import com.github.anirbanmu.classcal.calendar.EventPayload;
import com.github.anirbanmu.classcal.calendar.google.json.CalendarListPage;
import com.github.anirbanmu.classcal.calendar.google.json.CalendarResource;
import com.github.anirbanmu.classcal.calendar.google.json.EventResource;
import com.github.anirbanmu.classcal.calendar.google.json.NewCalendar;
import com.github.anirbanmu.classcal.log.Log;
import com.github.anirbanmu.classcal.util.Http;
import com.github.anirbanmu.classcal.util.Json;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Calendar v3 over plain http. Calendars are addressed by their summary; the OAuth
 * access token is obtained elsewhere and passed in.
 */
public class GoogleCalendarClient implements CalendarSink {
    public static final String DEFAULT_BASE_URL = "https://www.googleapis.com/calendar/v3";

    private final String baseUrl;
    private final String accessToken;
    private final ZoneId zone;
    private final HttpClient http;

    public GoogleCalendarClient(String baseUrl, String accessToken, ZoneId zone) {
        this(baseUrl, accessToken, zone, Http.CLIENT);
    }

    GoogleCalendarClient(String baseUrl, String accessToken, ZoneId zone, HttpClient http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken = accessToken;
        this.zone = zone;
        this.http = http;
    }

    public CalendarResult<List<CalendarListPage.Entry>> listCalendars() {
        List<CalendarListPage.Entry> all = new ArrayList<>();
        String pageToken = null;
        do {
            String url = baseUrl + "/users/me/calendarList";
            if (pageToken != null) {
                url += "?pageToken=" + URLEncoder.encode(pageToken, StandardCharsets.UTF_8);
            }
            CalendarResult<CalendarListPage> page = sendFor(CalendarListPage.class, request(url).GET());
            if (page instanceof CalendarResult.Failure<CalendarListPage> f) {
                return f.cast();
            }
            CalendarListPage value = ((CalendarResult.Success<CalendarListPage>) page).value();
            if (value.items() != null) {
                all.addAll(value.items());
            }
            pageToken = value.nextPageToken();
        } while (pageToken != null && !pageToken.isEmpty());
        return new CalendarResult.Success<>(all);
    }

    public CalendarResult<String> calendarId(String name) {
        CalendarResult<List<CalendarListPage.Entry>> calendars = listCalendars();
        if (calendars instanceof CalendarResult.Failure<List<CalendarListPage.Entry>> f) {
            return f.cast();
        }
        for (CalendarListPage.Entry entry : calendars.orThrow()) {
            if (name.equals(entry.summary())) {
                return new CalendarResult.Success<>(entry.id());
            }
        }
        return new CalendarResult.Failure<>("Cannot find '" + name + "' id. You might need to create a calendar first.");
    }

    @Override
    public boolean exists(String name) {
        for (CalendarListPage.Entry entry : listCalendars().orThrow()) {
            if (name.equals(entry.summary())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void createCalendar(String name) {
        CalendarResource created = sendFor(CalendarResource.class, request(baseUrl + "/calendars")
            .header("Content-Type", "application/json")
            .POST(body(new NewCalendar(name, zone.getId())))).orThrow();
        Log.info("google.calendar_created", "calendar", created.summary(), "id", created.id());
    }

    @Override
    public void renameCalendar(String name, String newName) {
        String url = calendarUrl(calendarId(name).orThrow());
        CalendarResource current = sendFor(CalendarResource.class, request(url).GET()).orThrow();
        CalendarResource updated = sendFor(CalendarResource.class, request(url)
            .header("Content-Type", "application/json")
            .PUT(body(current.withSummary(newName)))).orThrow();
        Log.info("google.calendar_renamed", "calendar", name, "new_name", updated.summary());
    }

    @Override
    public void deleteCalendar(String name) {
        send(request(calendarUrl(calendarId(name).orThrow())).DELETE()).orThrow();
        Log.info("google.calendar_deleted", "calendar", name);
    }

    @Override
    public void insertEvents(String calendarName, List<EventPayload> events) {
        String url = calendarUrl(calendarId(calendarName).orThrow()) + "/events";
        for (EventPayload p : events) {
            EventResource inserted = sendFor(EventResource.class, request(url)
                .header("Content-Type", "application/json")
                .POST(body(toResource(p)))).orThrow();
            Log.info("google.event_inserted", "summary", inserted.summary());
        }
    }

    EventResource toResource(EventPayload p) {
        List<EventResource.ReminderOverride> overrides = p.reminderMinutes() > 0
            ? List.of(new EventResource.ReminderOverride(EventResource.REMINDER_POPUP, p.reminderMinutes()))
            : List.of();
        List<String> recurrence = p.recurring() ? List.of(p.recurrenceRule()) : List.of();

        return new EventResource(
            p.summary(),
            p.location(),
            p.description(),
            time(p.start()),
            time(p.end()),
            String.valueOf(p.colorId()),
            new EventResource.Reminders(false, overrides),
            recurrence);
    }

    private EventResource.EventTime time(ZonedDateTime t) {
        return new EventResource.EventTime(t.withZoneSameInstant(zone).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME), zone.getId());
    }

    private String calendarUrl(String calendarId) {
        return baseUrl + "/calendars/" + URLEncoder.encode(calendarId, StandardCharsets.UTF_8);
    }

    private HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder(URI.create(url))
            .header("Authorization", "Bearer " + accessToken)
            .timeout(Http.REQUEST_TIMEOUT);
    }

    private HttpRequest.BodyPublisher body(Object data) {
        try {
            return HttpRequest.BodyPublishers.ofByteArray(Json.toBytes(data));
        } catch (IOException e) {
            throw new CalendarSinkException("Failed to serialize request body", e);
        }
    }

    private <T> CalendarResult<T> sendFor(Class<T> type, HttpRequest.Builder builder) {
        CalendarResult<String> raw = send(builder);
        if (raw instanceof CalendarResult.Failure<String> f) {
            return f.cast();
        }
        try {
            T value = Json.parse(type, raw.orThrow());
            if (value == null) {
                return new CalendarResult.Failure<>("Empty response body");
            }
            return new CalendarResult.Success<>(value);
        } catch (IOException e) {
            return new CalendarResult.Failure<>("Unreadable response body", e);
        }
    }

    private CalendarResult<String> send(HttpRequest.Builder builder) {
        try {
            HttpResponse<String> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                Log.error("google.request_failed", "status", response.statusCode(), "uri", response.uri());
                return new CalendarResult.Failure<>("Google Calendar API error", response.statusCode());
            }
            return new CalendarResult.Success<>(response.body());
        } catch (IOException e) {
            return new CalendarResult.Failure<>("HTTP request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new CalendarResult.Failure<>("HTTP request interrupted", e);
        }
    }
}
