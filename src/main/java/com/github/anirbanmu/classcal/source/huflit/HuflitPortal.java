package com.github.anirbanmu.classcal.source.huflit;

import com.github.anirbanmu.classcal.log.Log;
import com.github.anirbanmu.classcal.source.AuthenticationException;
import com.github.anirbanmu.classcal.source.Credentials;
import com.github.anirbanmu.classcal.source.Portal;
import com.github.anirbanmu.classcal.source.PortalSession;
import com.github.anirbanmu.classcal.source.RawRecord;
import com.github.anirbanmu.classcal.source.SemesterOptions;
import com.github.anirbanmu.classcal.source.SemesterSelection;
import com.github.anirbanmu.classcal.util.Http;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Form-login portal. A successful login or logout is recognised by the redirect it causes.
 */
public final class HuflitPortal implements Portal {
    static final String HOME_ENDPOINT = "/Home";
    static final String LOGIN_ENDPOINT = "/Login";
    static final String LOGOUT_ENDPOINT = "/Login/Logout";
    static final String SCHEDULE_API = "/Home/DrawingStudentSchedule_Perior";
    static final String SCHEDULE_ENDPOINT = "/Home/Schedules";

    private final String baseUrl;

    public HuflitPortal(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    @Override
    public PortalSession login(Credentials credentials) throws IOException, InterruptedException {
        return new Session(Http.newSessionClient(), baseUrl, credentials);
    }

    static final class Session implements PortalSession {
        private final HttpClient client;
        private final String baseUrl;
        private boolean loggedIn;

        Session(HttpClient client, String baseUrl, Credentials credentials) throws IOException, InterruptedException {
            this.client = client;
            this.baseUrl = baseUrl;

            if (credentials.username() == null || credentials.username().isBlank()) {
                throw new AuthenticationException("Username is blank.");
            }

            Log.info("huflit.login", "user", credentials.username());
            Map<String, String> form = new LinkedHashMap<>();
            form.put("txtTaiKhoan", credentials.username());
            form.put("txtMatKhau", credentials.password());

            HttpResponse<String> res = client.send(HttpRequest.newBuilder(URI.create(baseUrl + LOGIN_ENDPOINT))
                .timeout(Http.REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(Http.form(form))
                .build(), HttpResponse.BodyHandlers.ofString());

            // the portal redirects to the home page only when the credentials were accepted
            if (res.previousResponse().isEmpty()) {
                throw new AuthenticationException("Login failed.");
            }
            loggedIn = true;
        }

        @Override
        public boolean loggedIn() {
            return loggedIn;
        }

        @Override
        public SemesterOptions semesters() throws IOException, InterruptedException {
            requireLogin();
            return HuflitPages.semesterOptions(get(baseUrl + SCHEDULE_ENDPOINT).body());
        }

        @Override
        public List<RawRecord> fetch(SemesterSelection selection) throws IOException, InterruptedException {
            requireLogin();
            semesters().validate(selection);

            Map<String, String> params = new LinkedHashMap<>();
            params.put("YearStudy", selection.year());
            params.put("TermID", selection.semester());
            HttpResponse<String> res = get(baseUrl + SCHEDULE_API + "?" + Http.encode(params));

            HuflitPages.Result result = HuflitPages.scheduleRows(res.body());
            if (result.notice() != null) {
                Log.info("huflit.no_schedule", "notice", result.notice());
            }
            Log.info("huflit.fetched", "semester", selection.semester(), "year", selection.year(), "rows", result.rows().size());
            return result.rows();
        }

        @Override
        public void close() throws IOException, InterruptedException {
            requireLogin();
            Log.info("huflit.logout");

            get(baseUrl + LOGOUT_ENDPOINT);
            // a logged out session gets bounced from the home page
            HttpResponse<String> home = get(baseUrl + HOME_ENDPOINT);
            if (home.previousResponse().isEmpty()) {
                throw new AuthenticationException("Logout failed.");
            }
            loggedIn = false;
        }

        private void requireLogin() {
            if (!loggedIn) {
                throw new AuthenticationException("User is not logged in.");
            }
        }

        private HttpResponse<String> get(String url) throws IOException, InterruptedException {
            return client.send(HttpRequest.newBuilder(URI.create(url))
                .timeout(Http.REQUEST_TIMEOUT)
                .GET()
                .build(), HttpResponse.BodyHandlers.ofString());
        }
    }
}
