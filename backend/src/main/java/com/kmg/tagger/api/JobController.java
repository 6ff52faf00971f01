package com.kmg.tagger.api;

import com.kmg.tagger.dto.JobRequest;
import com.kmg.tagger.dto.JobStartedResponse;
import com.kmg.tagger.dto.JobView;
import com.kmg.tagger.service.TaggingJobService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private final TaggingJobService jobService;

    public JobController(TaggingJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping
    public ResponseEntity<JobStartedResponse> start(@Valid @RequestBody JobRequest request) {
        return ResponseEntity.accepted().body(new JobStartedResponse(jobService.startJob(request)));
    }

    @GetMapping
    public List<JobView> listJobs() {
        return jobService.listJobs();
    }

    @GetMapping("/{id}")
    public JobView getJob(@PathVariable String id) {
        return jobService.getJob(id);
    }

    @GetMapping(value = "/{id}/sequence-preview", produces = "text/plain")
    public ResponseEntity<String> sequencePreview(@PathVariable String id) {
        String preview = jobService.sequencePreview(id);
        return preview == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(preview);
    }
}
