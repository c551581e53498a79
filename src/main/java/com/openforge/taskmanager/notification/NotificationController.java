package com.openforge.taskmanager.notification;

import com.openforge.taskmanager.domain.User;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * The current user's notifications.
 *
 * Endpoints:
 *   GET  /api/notifications?unread_only=   - newest first
 *   GET  /api/notifications/unread-count
 *   POST /api/notifications/{id}/read
 *   GET  /api/notifications/preferences
 *   PUT  /api/notifications/preferences
 */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationService notificationService;

    public record PreferencesRequest(
            Boolean emailEnabled,
            Boolean pushEnabled,
            Boolean smsEnabled
    ) {}

    public record PreferencesResponse(
            boolean emailEnabled,
            boolean pushEnabled,
            boolean smsEnabled,
            boolean inAppEnabled
    ) {
        static PreferencesResponse from(NotificationPreferences p) {
            return new PreferencesResponse(p.emailEnabled(), p.pushEnabled(), p.smsEnabled(), p.inAppEnabled());
        }
    }

    @GetMapping({"", "/"})
    public List<NotificationResponse> list(
            @AuthenticationPrincipal User currentUser,
            @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly) {

        return notificationService.forUser(currentUser.getId(), unreadOnly)
                .stream().map(NotificationResponse::from).toList();
    }

    @GetMapping("/unread-count")
    public Map<String, Long> unreadCount(@AuthenticationPrincipal User currentUser) {
        return Map.of("unread_count", notificationService.unreadCount(currentUser.getId()));
    }

    @PostMapping("/{notificationId}/read")
    public NotificationResponse markAsRead(
            @AuthenticationPrincipal User currentUser,
            @PathVariable long notificationId) {

        return NotificationResponse.from(notificationService.markAsRead(currentUser.getId(), notificationId));
    }

    @GetMapping("/preferences")
    public PreferencesResponse preferences(@AuthenticationPrincipal User currentUser) {
        return PreferencesResponse.from(notificationService.preferences(currentUser.getId()));
    }

    /** Missing switches default to email on, push on, SMS off. */
    @PutMapping("/preferences")
    public PreferencesResponse setPreferences(
            @AuthenticationPrincipal User currentUser,
            @RequestBody PreferencesRequest req) {

        NotificationPreferences saved = notificationService.setPreferences(
                currentUser.getId(),
                req.emailEnabled() == null || req.emailEnabled(),
                req.pushEnabled()  == null || req.pushEnabled(),
                req.smsEnabled()   != null && req.smsEnabled());
        return PreferencesResponse.from(saved);
    }
}
