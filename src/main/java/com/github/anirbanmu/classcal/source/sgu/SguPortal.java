package com.github.anirbanmu.classcal.source.sgu;

import com.dslplatform.json.CompiledJson;
import com.dslplatform.json.JsonAttribute;
import com.github.anirbanmu.classcal.log.Log;
import com.github.anirbanmu.classcal.source.AuthenticationException;
import com.github.anirbanmu.classcal.source.Credentials;
import com.github.anirbanmu.classcal.source.Portal;
import com.github.anirbanmu.classcal.source.PortalSession;
import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.SemesterOptions;
import com.github.anirbanmu.classcal.source.SemesterSelection;
import com.github.anirbanmu.classcal.util.Http;
import com.github.anirbanmu.classcal.util.Json;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Token-login portal: the login call returns a bearer token sent with every later request,
 * and the timetable itself is an ASP.NET postback carrying the page's view state.
 */
public final class SguPortal implements Portal {
    static final String LOGIN_ENDPOINT = "/api/auth/login";
    static final String LOGOUT_ENDPOINT = "/api/auth/logout";
    static final String SCHEDULE_ENDPOINT = "/default.aspx?page=thoikhoabieu&sta=1";
    private static final int CODE_OK = 200;

    private final String baseUrl;

    public SguPortal(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    @Override
    public PortalSession login(Credentials credentials) throws IOException, InterruptedException {
        return new Session(Http.newSessionClient(), baseUrl, credentials);
    }

    static final class Session implements PortalSession {
        private final HttpClient client;
        private final String baseUrl;
        private final String authorization;
        private final String name;
        private boolean loggedIn;

        Session(HttpClient client, String baseUrl, Credentials credentials) throws IOException, InterruptedException {
            this.client = client;
            this.baseUrl = baseUrl;

            if (credentials.username() == null || credentials.username().isBlank()) {
                throw new AuthenticationException("Username is blank.");
            }

            Log.info("sgu.login", "user", credentials.username());
            Map<String, String> form = new LinkedHashMap<>();
            form.put("username", credentials.username());
            form.put("password", credentials.password());
            form.put("grant_type", "password");

            HttpResponse<String> res = client.send(HttpRequest.newBuilder(URI.create(baseUrl + LOGIN_ENDPOINT))
                .timeout(Http.REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(Http.form(form))
                .build(), HttpResponse.BodyHandlers.ofString());

            LoginResponse login = parse(res.body());
            if (login.code() != CODE_OK) {
                throw new AuthenticationException(login.message() != null ? login.message() : "Login failed.");
            }

            this.name = login.name();
            this.authorization = login.tokenType() + " " + login.accessToken();
            this.loggedIn = true;
        }

        String name() {
            return name;
        }

        @Override
        public boolean loggedIn() {
            return loggedIn;
        }

        @Override
        public SemesterOptions semesters() throws IOException, InterruptedException {
            requireLogin();
            return SguPages.semesterOptions(get(baseUrl + SCHEDULE_ENDPOINT).body());
        }

        @Override
        public List<RawRecord> fetch(SemesterSelection selection) throws IOException, InterruptedException {
            requireLogin();
            semesters().validate(selection);

            String viewState = SguPages.viewState(get(baseUrl + SCHEDULE_ENDPOINT).body());

            Map<String, String> form = new LinkedHashMap<>();
            form.put("__EVENTTARGET", "ctl00$ContentPlaceHolder1$ctl00$rad_ThuTiet");
            form.put("__EVENTARGUMENT", "");
            form.put("__LASTFOCUS", "");
            form.put("__VIEWSTATE", viewState);
            form.put("ctl00$ContentPlaceHolder1$ctl00$ddlChonNHHK", selection.semester());
            form.put("ctl00$ContentPlaceHolder1$ctl00$ddlLoai", "1");
            form.put("ctl00$ContentPlaceHolder1$ctl00$rad_ThuTiet", "rad_ThuTiet");
            form.put("ctl00$ContentPlaceHolder1$ctl00$rad_MonHoc", "rad_MonHoc");

            HttpResponse<String> res = client.send(request(baseUrl + SCHEDULE_ENDPOINT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(Http.form(form))
                .build(), HttpResponse.BodyHandlers.ofString());

            List<RawRecord> rows = SguPages.scheduleRows(res.body());
            Log.info("sgu.fetched", "semester", selection.semester(), "rows", rows.size());
            return rows;
        }

        @Override
        public void close() throws IOException, InterruptedException {
            requireLogin();
            Log.info("sgu.logout");

            HttpResponse<String> res = client.send(request(baseUrl + LOGOUT_ENDPOINT)
                .POST(HttpRequest.BodyPublishers.noBody())
                .build(), HttpResponse.BodyHandlers.ofString());

            LoginResponse logout = parse(res.body());
            if (logout.code() != CODE_OK) {
                throw new AuthenticationException("Logout failed.");
            }
            loggedIn = false;
        }

        private void requireLogin() {
            if (!loggedIn) {
                throw new AuthenticationException("User is not logged in.");
            }
        }

        private HttpRequest.Builder request(String url) {
            return HttpRequest.newBuilder(URI.create(url))
                .timeout(Http.REQUEST_TIMEOUT)
                .header("Authorization", authorization);
        }

        private HttpResponse<String> get(String url) throws IOException, InterruptedException {
            return client.send(request(url).GET().build(), HttpResponse.BodyHandlers.ofString());
        }

        private static LoginResponse parse(String body) {
            try {
                LoginResponse parsed = Json.parse(LoginResponse.class, body);
                if (parsed == null) {
                    throw new AuthenticationException("Empty authentication response.");
                }
                return parsed;
            } catch (IOException e) {
                throw new AuthenticationException("Unreadable authentication response.", e);
            }
        }
    }

    @CompiledJson(onUnknown = CompiledJson.Behavior.IGNORE)
    record LoginResponse(
        int code,
        @JsonAttribute(nullable = true) String message,
        @JsonAttribute(nullable = true) String name,
        @JsonAttribute(name = "token_type", nullable = true) String tokenType,
        @JsonAttribute(name = "access_token", nullable = true) String accessToken) {
    }
}
