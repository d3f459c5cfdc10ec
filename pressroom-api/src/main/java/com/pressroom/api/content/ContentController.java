package com.pressroom.api.content;

import com.pressroom.api.read.ContentPage;
import com.pressroom.api.read.ContentView;
import com.pressroom.api.read.ReadCoordinator;
import com.pressroom.api.write.WriteCoordinator;
import com.pressroom.core.domain.Content;
import com.pressroom.core.domain.ContentStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for content.
 */
@RestController
@RequestMapping("/api/v1/contents")
public class ContentController {

    static final String DEFAULT_SCOPE = "active";

    private final WriteCoordinator writeCoordinator;
    private final ReadCoordinator readCoordinator;

    public ContentController(WriteCoordinator writeCoordinator, ReadCoordinator readCoordinator) {
        this.writeCoordinator = writeCoordinator;
        this.readCoordinator = readCoordinator;
    }

    /**
     * Create content and attach tags by name in one step.
     * POST /api/v1/contents
     */
    @PostMapping
    public ResponseEntity<ContentView> createContent(@RequestBody CreateContentRequest request) {
        Content content = writeCoordinator.createContentWithTags(
                request.accountId(),
                request.title(),
                request.body(),
                parseStatus(request.status()),
                request.tags());
        return ResponseEntity.status(HttpStatus.CREATED).body(readCoordinator.getContentById(content.getId()));
    }

    /**
     * List content, newest first.
     * GET /api/v1/contents?status=active&page=1&limit=10
     */
    @GetMapping
    public ResponseEntity<ContentPage> listContent(
            @RequestParam(defaultValue = DEFAULT_SCOPE) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "10") int limit) {
        return ResponseEntity.ok(readCoordinator.listContent(status, page, limit));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ContentView> getContent(@PathVariable Long id) {
        return ResponseEntity.ok(readCoordinator.getContentById(id));
    }

    /**
     * Update the fields present in the body.
     * PUT /api/v1/contents/{id}
     */
    @PutMapping("/{id}")
    public ResponseEntity<ContentView> updateContent(
            @PathVariable Long id,
            @RequestBody UpdateContentRequest request) {
        writeCoordinator.updateContent(id, request.title(), request.body(), parseStatus(request.status()));
        return ResponseEntity.ok(readCoordinator.getContentById(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteContent(@PathVariable Long id) {
        writeCoordinator.deleteContent(id);
        return ResponseEntity.noContent().build();
    }

    private static ContentStatus parseStatus(String status) {
        return status == null ? null : ContentStatus.fromValue(status);
    }

    // Request DTOs
    public record CreateContentRequest(
            Long accountId,
            String title,
            String body,
            String status,
            List<String> tags
    ) {}

    public record UpdateContentRequest(String title, String body, String status) {}
}
