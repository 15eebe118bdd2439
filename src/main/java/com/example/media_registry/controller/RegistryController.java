package com.example.media_registry.controller;

import com.example.media_registry.dto.web.RegistryStatsResponse;
import com.example.media_registry.service.SequenceGenerator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/registry")
public class RegistryController {
    private final SequenceGenerator sequenceGenerator;

    public RegistryController(SequenceGenerator sequenceGenerator) {
        this.sequenceGenerator = sequenceGenerator;
    }

    @GetMapping("/stats")
    public RegistryStatsResponse stats() {
        return new RegistryStatsResponse(sequenceGenerator.current());
    }
}
