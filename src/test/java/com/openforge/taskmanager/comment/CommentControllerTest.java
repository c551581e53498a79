package com.openforge.taskmanager.comment;

import com.openforge.taskmanager.ApiTestSupport;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.repository.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;

import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CommentControllerTest extends ApiTestSupport {

    @Autowired private UserRepository userRepository;

    private long createTask(TestUser owner) throws Exception {
        return body(mvc.perform(post("/api/tasks/")
                        .header("Authorization", owner.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("title", "commented"))))
                .andExpect(status().isCreated())
                .andReturn()).get("id").asLong();
    }

    private long comment(TestUser author, long taskId, String text) throws Exception {
        return body(mvc.perform(post("/api/comments")
                        .header("Authorization", author.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("task_id", taskId, "text", text))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.task_id").value(taskId))
                .andExpect(jsonPath("$.user_id").value(author.id()))
                .andReturn()).get("id").asLong();
    }

    @Test
    void ownerCommentsAndListsInOrder() throws Exception {
        TestUser owner = newUser();
        long taskId = createTask(owner);

        comment(owner, taskId, "first");
        comment(owner, taskId, "second");

        mvc.perform(get("/api/comments/task/" + taskId).header("Authorization", owner.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].text").value("first"))
                .andExpect(jsonPath("$[1].text").value("second"));
    }

    @Test
    void strangersCannotReadOrWriteComments() throws Exception {
        TestUser owner = newUser();
        TestUser stranger = newUser();
        long taskId = createTask(owner);

        mvc.perform(post("/api/comments")
                        .header("Authorization", stranger.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("task_id", taskId, "text", "hi"))))
                .andExpect(status().isForbidden());

        mvc.perform(get("/api/comments/task/" + taskId).header("Authorization", stranger.bearer()))
                .andExpect(status().isForbidden());
    }

    @Test
    void onlyAuthorOrAdminMayDelete() throws Exception {
        TestUser owner = newUser();
        TestUser stranger = newUser();
        TestUser admin = newUser();
        User adminEntity = userRepository.findById(admin.id()).orElseThrow();
        adminEntity.setAdmin(true);
        userRepository.save(adminEntity);

        long taskId = createTask(owner);
        long first = comment(owner, taskId, "keep?");
        long second = comment(owner, taskId, "remove");

        mvc.perform(delete("/api/comments/" + first).header("Authorization", stranger.bearer()))
                .andExpect(status().isForbidden());

        mvc.perform(delete("/api/comments/" + first).header("Authorization", owner.bearer()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true));
        mvc.perform(delete("/api/comments/" + second).header("Authorization", admin.bearer()))
                .andExpect(status().isOk());

        mvc.perform(delete("/api/comments/" + first).header("Authorization", owner.bearer()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Comment not found"));
    }

    @Test
    void commentOnMissingTaskOrBlankTextIsRejected() throws Exception {
        TestUser owner = newUser();

        mvc.perform(post("/api/comments")
                        .header("Authorization", owner.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("task_id", Long.MAX_VALUE, "text", "hi"))))
                .andExpect(status().isNotFound());

        mvc.perform(post("/api/comments")
                        .header("Authorization", owner.bearer())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("task_id", createTask(owner), "text", " "))))
                .andExpect(status().isUnprocessableEntity());
    }
}
