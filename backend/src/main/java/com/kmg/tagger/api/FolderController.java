package com.kmg.tagger.api;

import com.kmg.tagger.dto.FolderStatsResponse;
import com.kmg.tagger.service.ImageScanner;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/folders")
public class FolderController {
    private final ImageScanner imageScanner;

    public FolderController(ImageScanner imageScanner) {
        this.imageScanner = imageScanner;
    }

    @GetMapping("/stats")
    public FolderStatsResponse stats(@RequestParam("path") String path) {
        return imageScanner.computeStats(path);
    }
}
