package com.pressroom.api.content;

import com.pressroom.api.write.WriteCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for tagging existing content.
 */
@RestController
@RequestMapping("/api/v1/content-tags")
public class ContentTagController {

    private final WriteCoordinator writeCoordinator;

    public ContentTagController(WriteCoordinator writeCoordinator) {
        this.writeCoordinator = writeCoordinator;
    }

    /**
     * Attach a tag. Attaching an already attached tag succeeds.
     * POST /api/v1/content-tags/{contentId}
     */
    @PostMapping("/{contentId}")
    public ResponseEntity<TagLinkResponse> addTag(@PathVariable Long contentId, @RequestBody TagLinkRequest request) {
        boolean changed = writeCoordinator.addTagToContent(contentId, request.tagId());
        return ResponseEntity.ok(new TagLinkResponse(contentId, request.tagId(), changed, "Tag added to content"));
    }

    /**
     * Detach a tag. Detaching a tag that is not attached succeeds.
     * DELETE /api/v1/content-tags/{contentId}
     */
    @DeleteMapping("/{contentId}")
    public ResponseEntity<TagLinkResponse> removeTag(@PathVariable Long contentId, @RequestBody TagLinkRequest request) {
        boolean changed = writeCoordinator.removeTagFromContent(contentId, request.tagId());
        return ResponseEntity.ok(new TagLinkResponse(contentId, request.tagId(), changed, "Tag removed from content"));
    }

    public record TagLinkRequest(Long tagId) {}

    public record TagLinkResponse(Long contentId, Long tagId, boolean changed, String message) {}
}
