package com.herzen.recall.api;

import com.herzen.recall.scoring.ScoringModels.TestInstance;
import com.herzen.recall.testdef.TestDefinitionModels.TestRequest;
import com.herzen.recall.testdef.TestDefinitionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/tests")
public class TestController {
    private final TestDefinitionService testDefinitionService;

    public TestController(TestDefinitionService testDefinitionService) {
        this.testDefinitionService = testDefinitionService;
    }

    @PostMapping
    public ResponseEntity<TestInstance> register(@RequestBody TestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(testDefinitionService.register(request));
    }

    @PostMapping("/generate")
    public ResponseEntity<TestInstance> generate(@RequestBody TestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(testDefinitionService.generate(request));
    }

    @GetMapping("/{testId}")
    public ResponseEntity<TestInstance> get(@PathVariable String testId) {
        return ResponseEntity.ok(testDefinitionService.find(testId));
    }
}
