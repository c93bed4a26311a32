package com.flamingo.ai.notesearch.api.rest;

import com.flamingo.ai.notesearch.api.dto.response.ProfileResponse;
import com.flamingo.ai.notesearch.service.profile.ProfileRegistry;
import com.flamingo.ai.notesearch.service.profile.SearchProfile;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for search profiles. */
@RestController
@RequestMapping("/api/profiles")
@RequiredArgsConstructor
public class ProfileController {

  private final ProfileRegistry profileRegistry;

  /** Lists built-in and configured profiles. */
  @GetMapping
  public ResponseEntity<List<ProfileResponse>> listProfiles() {
    return ResponseEntity.ok(profileRegistry.list().stream().map(this::toResponse).toList());
  }

  /** Gets a profile by name. */
  @GetMapping("/{name}")
  public ResponseEntity<ProfileResponse> getProfile(@PathVariable String name) {
    return ResponseEntity.ok(toResponse(profileRegistry.get(name)));
  }

  private ProfileResponse toResponse(SearchProfile profile) {
    return ProfileResponse.fromProfile(profile, profileRegistry.isBuiltIn(profile.getName()));
  }
}
