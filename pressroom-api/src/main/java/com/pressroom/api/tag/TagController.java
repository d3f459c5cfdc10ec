package com.pressroom.api.tag;

import com.pressroom.api.read.ReadCoordinator;
import com.pressroom.api.write.WriteCoordinator;
import com.pressroom.core.domain.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the tag taxonomy.
 */
@RestController
@RequestMapping("/api/v1/tags")
public class TagController {

    private final WriteCoordinator writeCoordinator;
    private final ReadCoordinator readCoordinator;

    public TagController(WriteCoordinator writeCoordinator, ReadCoordinator readCoordinator) {
        this.writeCoordinator = writeCoordinator;
        this.readCoordinator = readCoordinator;
    }

    @PostMapping
    public ResponseEntity<Tag> createTag(@RequestBody TagRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(writeCoordinator.createTag(request.name()));
    }

    @GetMapping
    public ResponseEntity<List<Tag>> listTags() {
        return ResponseEntity.ok(readCoordinator.listTags());
    }

    @PutMapping("/{id}")
    public ResponseEntity<Tag> updateTag(@PathVariable Long id, @RequestBody TagRequest request) {
        return ResponseEntity.ok(writeCoordinator.updateTag(id, request.name()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteTag(@PathVariable Long id) {
        writeCoordinator.deleteTag(id);
        return ResponseEntity.noContent().build();
    }

    public record TagRequest(String name) {}
}
