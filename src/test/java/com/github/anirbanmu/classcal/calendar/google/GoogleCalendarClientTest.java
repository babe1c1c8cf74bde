package com.github.anirbanmu.classcal.calendar.google;

import static org.junit.jupiter.api.Assertions.*;

import com.github.anirbanmu.classcal.calendar.CalendarSinkException;
import com.github.anirbanmu.classcal.calendar.EventPayload;
import com.github.anirbanmu.classcal.calendar.google.json.EventResource;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GoogleCalendarClientTest {
    private static final ZoneId SAIGON = ZoneId.of("Asia/Ho_Chi_Minh");
    private static final String CLASS_ID = "cls@group.calendar.google.com";
    private static final String CLASS_PATH = "/calendars/cls%40group.calendar.google.com";

    private HttpServer server;
    private String baseUrl;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/users/me/calendarList", ex -> {
            read(ex);
            if (!authorized(ex)) {
                return;
            }
            if ("pageToken=p2".equals(ex.getRequestURI().getRawQuery())) {
                respond(ex, 200, """
                    {"kind":"calendar#calendarList","items":[{"id":"cls@group.calendar.google.com","summary":"Class Schedule","accessRole":"owner"}]}""");
            } else {
                respond(ex, 200, """
                    {"kind":"calendar#calendarList","items":[{"id":"primary@gmail.com","summary":"Personal"}],"nextPageToken":"p2"}""");
            }
        });
        server.createContext("/calendars", ex -> {
            String body = read(ex);
            if (!authorized(ex)) {
                return;
            }
            String method = ex.getRequestMethod();
            String path = ex.getRequestURI().getRawPath();
            requests.add(method + " " + path);

            if (method.equals("POST") && path.equals("/calendars")) {
                bodies.add(body);
                if (body.contains("boom")) {
                    respond(ex, 500, "{\"error\":{\"code\":500}}");
                    return;
                }
                respond(ex, 200, "{\"id\":\"new@group.calendar.google.com\",\"summary\":\"Created\",\"timeZone\":\"Asia/Ho_Chi_Minh\"}");
            } else if (method.equals("POST") && path.equals(CLASS_PATH + "/events")) {
                bodies.add(body);
                respond(ex, 200, body);
            } else if (method.equals("GET") && path.equals(CLASS_PATH)) {
                respond(ex, 200, "{\"id\":\"" + CLASS_ID + "\",\"summary\":\"Class Schedule\",\"timeZone\":\"Asia/Ho_Chi_Minh\",\"etag\":\"x\"}");
            } else if (method.equals("PUT") && path.equals(CLASS_PATH)) {
                bodies.add(body);
                respond(ex, 200, body);
            } else if (method.equals("DELETE") && path.equals(CLASS_PATH)) {
                respond(ex, 204, "");
            } else {
                respond(ex, 404, "{}");
            }
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private GoogleCalendarClient client() {
        return new GoogleCalendarClient(baseUrl + "/", "tok", SAIGON);
    }

    private static EventPayload payload(int weeklyCount, int reminderMinutes) {
        ZonedDateTime start = ZonedDateTime.of(2023, 9, 4, 7, 0, 0, 0, SAIGON);
        return new EventPayload("841020 Lập trình Java", "C.A101", "Class: DCT1201\nLecturer: A", start, start.plusMinutes(100), weeklyCount, 2, reminderMinutes);
    }

    @Test
    void testExistsWalksEveryPage() {
        GoogleCalendarClient client = client();

        assertTrue(client.exists("Class Schedule"));
        assertTrue(client.exists("Personal"));
        assertFalse(client.exists("Nope"));
        assertEquals(CLASS_ID, client.calendarId("Class Schedule").orThrow());
    }

    @Test
    void testCreateCalendar() {
        client().createCalendar("HK1 2023");

        assertTrue(bodies.get(0).contains("\"summary\":\"HK1 2023\""), bodies.get(0));
        assertTrue(bodies.get(0).contains("\"timeZone\":\"Asia/Ho_Chi_Minh\""), bodies.get(0));
    }

    @Test
    void testServerErrorCarriesStatus() {
        CalendarSinkException e = assertThrows(CalendarSinkException.class, () -> client().createCalendar("boom"));
        assertEquals(500, e.statusCode());
    }

    @Test
    void testBadTokenIsUnauthorized() {
        GoogleCalendarClient client = new GoogleCalendarClient(baseUrl, "expired", SAIGON);

        CalendarSinkException e = assertThrows(CalendarSinkException.class, () -> client.exists("Class Schedule"));
        assertEquals(401, e.statusCode());
    }

    @Test
    void testInsertEvents() {
        client().insertEvents("Class Schedule", List.of(payload(10, 30), payload(0, 30)));

        assertEquals(2, bodies.size());
        String weekly = bodies.get(0);
        assertTrue(weekly.contains("\"dateTime\":\"2023-09-04T07:00:00+07:00\""), weekly);
        assertTrue(weekly.contains("\"timeZone\":\"Asia/Ho_Chi_Minh\""), weekly);
        assertTrue(weekly.contains("\"colorId\":\"2\""), weekly);
        assertTrue(weekly.contains("\"recurrence\":[\"RRULE:FREQ=WEEKLY;COUNT=10\"]"), weekly);
        assertTrue(weekly.contains("\"method\":\"popup\""), weekly);

        assertTrue(bodies.get(1).contains("\"recurrence\":[]"), bodies.get(1));
    }

    @Test
    void testInsertIntoMissingCalendar() {
        CalendarSinkException e = assertThrows(CalendarSinkException.class,
            () -> client().insertEvents("Nope", List.of(payload(1, 0))));
        assertTrue(e.getMessage().contains("Cannot find 'Nope'"), e.getMessage());
    }

    @Test
    void testRenameSendsUpdatedResource() {
        client().renameCalendar("Class Schedule", "Lịch học");

        assertEquals(List.of("GET " + CLASS_PATH, "PUT " + CLASS_PATH), requests);
        assertTrue(bodies.get(0).contains("\"summary\":\"Lịch học\""), bodies.get(0));
        assertTrue(bodies.get(0).contains("\"id\":\"" + CLASS_ID + "\""), bodies.get(0));
    }

    @Test
    void testDelete() {
        client().deleteCalendar("Class Schedule");

        assertEquals(List.of("DELETE " + CLASS_PATH), requests);
    }

    @Test
    void testResourceWithoutRecurrenceOrReminder() {
        EventResource r = client().toResource(payload(0, 0));

        assertTrue(r.recurrence().isEmpty());
        assertTrue(r.reminders().overrides().isEmpty());
        assertFalse(r.reminders().useDefault());
        assertEquals("2", r.colorId());
    }

    private static boolean authorized(HttpExchange ex) throws IOException {
        if ("Bearer tok".equals(ex.getRequestHeaders().getFirst("Authorization"))) {
            return true;
        }
        respond(ex, 401, "{\"error\":{\"code\":401}}");
        return false;
    }

    private static String read(HttpExchange ex) throws IOException {
        return new String(ex.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
    }

    private static void respond(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }
}
