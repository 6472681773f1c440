package com.herzen.recall.api;

import com.herzen.recall.norms.NormativeModels.NormativeProfile;
import com.herzen.recall.norms.NormativeProfileRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/norms")
public class NormativeProfileController {
    private final NormativeProfileRegistry registry;

    public NormativeProfileController(NormativeProfileRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/profiles")
    public ResponseEntity<List<NormativeProfile>> profiles() {
        return ResponseEntity.ok(registry.all());
    }
}
