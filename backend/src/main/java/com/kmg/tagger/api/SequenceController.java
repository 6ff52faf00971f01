package com.kmg.tagger.api;

import com.kmg.tagger.dto.SequencePreviewRequest;
import com.kmg.tagger.dto.SequencePreviewResponse;
import com.kmg.tagger.service.SequenceService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sequences")
public class SequenceController {
    private final SequenceService sequenceService;

    public SequenceController(SequenceService sequenceService) {
        this.sequenceService = sequenceService;
    }

    @PostMapping("/preview")
    public SequencePreviewResponse preview(@Valid @RequestBody SequencePreviewRequest request) {
        return sequenceService.preview(request);
    }
}
