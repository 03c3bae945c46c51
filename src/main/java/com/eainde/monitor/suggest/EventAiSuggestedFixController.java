package com.eainde.monitor.suggest;

import com.eainde.monitor.error.ResourceDoesNotExistException;
import com.eainde.monitor.project.Project;
import com.eainde.monitor.project.ProjectDirectory;
import com.eainde.monitor.ratelimit.RateLimit;
import com.eainde.monitor.ratelimit.RateLimitCategory;
import com.eainde.monitor.web.RequestActor;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Returns a JSON document with suggestions on how to understand or resolve an event.
 */
@RestController
@RequestMapping("/api/0/projects/{organizationSlug}/{projectSlug}/events/{eventId}")
@RequiredArgsConstructor
public class EventAiSuggestedFixController {

    static final String CONSENT_GIVEN = "yes";

    private final ProjectDirectory projectDirectory;
    private final SuggestedFixService suggestedFixService;

    @RateLimit(category = RateLimitCategory.IP, limit = 5, windowSeconds = 1)
    @RateLimit(category = RateLimitCategory.USER, limit = 5, windowSeconds = 1)
    @RateLimit(category = RateLimitCategory.ORGANIZATION, limit = 5, windowSeconds = 1)
    @GetMapping({"/ai-fix-suggest", "/ai-fix-suggest/"})
    public ResponseEntity<Map<String, String>> suggestFix(@PathVariable String organizationSlug,
                                                          @PathVariable String projectSlug,
                                                          @PathVariable String eventId,
                                                          @RequestParam(required = false) String consent,
                                                          HttpServletRequest request) {
        Project project = projectDirectory.findProject(organizationSlug, projectSlug)
                .orElseThrow(() -> new ResourceDoesNotExistException(
                        "Project " + organizationSlug + "/" + projectSlug + " not found"));

        SuggestionResult result = suggestedFixService.suggest(
                project, eventId, RequestActor.resolve(request), CONSENT_GIVEN.equals(consent));

        if (result.isRestricted()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Map.of("restriction", result.restriction().value()));
        }
        return ResponseEntity.ok(Map.of("suggestion", result.suggestion()));
    }
}
