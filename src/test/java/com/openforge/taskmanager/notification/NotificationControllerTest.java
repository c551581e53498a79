package com.openforge.taskmanager.notification;

import com.openforge.taskmanager.ApiTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class NotificationControllerTest extends ApiTestSupport {

    @Autowired private NotificationService notificationService;

    @Test
    void listCountAndMarkRead() throws Exception {
        TestUser user = newUser();
        Notification first = notificationService.send(user.id(), "first", "m");
        notificationService.send(user.id(), "second", "m");

        mvc.perform(get("/api/notifications/unread-count").header("Authorization", user.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.unread_count").value(2));

        mvc.perform(post("/api/notifications/" + first.getId() + "/read").header("Authorization", user.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.read_at").isNotEmpty());

        mvc.perform(get("/api/notifications").param("unread_only", "true").header("Authorization", user.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].title").value("second"));
    }

    @Test
    void cannotReadSomeoneElsesNotification() throws Exception {
        TestUser owner = newUser();
        TestUser other = newUser();
        Notification n = notificationService.send(owner.id(), "private", "m");

        mvc.perform(post("/api/notifications/" + n.getId() + "/read").header("Authorization", other.bearer()))
                .andExpect(status().isNotFound());
    }

    @Test
    void preferencesDefaultAndUpdate() throws Exception {
        TestUser user = newUser();

        mvc.perform(get("/api/notifications/preferences").header("Authorization", user.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email_enabled").value(true))
                .andExpect(jsonPath("$.sms_enabled").value(true))
                .andExpect(jsonPath("$.in_app_enabled").value(true));

        mvc.perform(put("/api/notifications/preferences")
                        .header("Authorization", user.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("push_enabled", false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email_enabled").value(true))
                .andExpect(jsonPath("$.push_enabled").value(false))
                .andExpect(jsonPath("$.sms_enabled").value(false))
                .andExpect(jsonPath("$.in_app_enabled").value(true));
    }
}
