package com.kmg.tagger.api;

import com.kmg.tagger.dto.ProgressView;
import com.kmg.tagger.service.ProgressService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/progress")
public class ProgressController {
    private final ProgressService progressService;

    public ProgressController(ProgressService progressService) {
        this.progressService = progressService;
    }

    @GetMapping
    public ProgressView progress(@RequestParam("path") String path) {
        return progressService.view(path);
    }

    @PostMapping("/reset")
    public ProgressView reset(@RequestParam("path") String path) {
        return progressService.reset(path);
    }
}
