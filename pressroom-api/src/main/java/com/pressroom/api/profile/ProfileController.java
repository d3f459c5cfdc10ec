package com.pressroom.api.profile;

import com.pressroom.api.read.ProfileView;
import com.pressroom.api.read.ReadCoordinator;
import com.pressroom.api.write.WriteCoordinator;
import com.pressroom.core.domain.Profile;
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

/**
 * REST API for profiles. A profile is addressed by the id of the account it belongs to.
 */
@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private final WriteCoordinator writeCoordinator;
    private final ReadCoordinator readCoordinator;

    public ProfileController(WriteCoordinator writeCoordinator, ReadCoordinator readCoordinator) {
        this.writeCoordinator = writeCoordinator;
        this.readCoordinator = readCoordinator;
    }

    @PostMapping
    public ResponseEntity<Profile> createProfile(@RequestBody CreateProfileRequest request) {
        Profile profile = writeCoordinator.createProfile(request.accountId(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(profile);
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<ProfileView> getProfile(@PathVariable Long accountId) {
        return ResponseEntity.ok(readCoordinator.getProfileByAccountId(accountId));
    }

    @PutMapping("/{accountId}")
    public ResponseEntity<Profile> updateProfile(
            @PathVariable Long accountId,
            @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(writeCoordinator.updateProfile(accountId, request.description()));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<Void> deleteProfile(@PathVariable Long accountId) {
        writeCoordinator.deleteProfile(accountId);
        return ResponseEntity.noContent().build();
    }

    // Request DTOs
    public record CreateProfileRequest(Long accountId, String description) {}

    public record UpdateProfileRequest(String description) {}
}
