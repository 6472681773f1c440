package com.herzen.recall.testdef;

import com.herzen.recall.repository.TestJdbcRepository;
import com.herzen.recall.scoring.RecallScoringEngine;
import com.herzen.recall.scoring.ScoringModels.Keypoint;
import com.herzen.recall.scoring.ScoringModels.TestInstance;
import com.herzen.recall.testdef.TestDefinitionModels.GeneratedContent;
import com.herzen.recall.testdef.TestDefinitionModels.TestPlan;
import com.herzen.recall.testdef.TestDefinitionModels.TestRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Service
public class TestDefinitionService {
    private static final Logger log = LoggerFactory.getLogger(TestDefinitionService.class);

    private final TestPlanner planner;
    private final RecallScoringEngine engine;
    private final TestJdbcRepository repository;
    private final ObjectProvider<PassageGenerator> generator;
    private final Clock clock;

    public TestDefinitionService(TestPlanner planner,
                                 RecallScoringEngine engine,
                                 TestJdbcRepository repository,
                                 ObjectProvider<PassageGenerator> generator,
                                 Clock clock) {
        this.planner = planner;
        this.engine = engine;
        this.repository = repository;
        this.generator = generator;
        this.clock = clock;
    }

    /** Builds and stores a test from a passage and keypoints produced outside this service. */
    public TestInstance register(TestRequest request) {
        TestPlan plan = planner.plan(request);
        return store(build(plan, new GeneratedContent(request.passage(), request.keypoints())));
    }

    /** Plans a test, asks the generation service for its content, then builds and stores it. */
    public TestInstance generate(TestRequest request) {
        PassageGenerator passageGenerator = generator.getIfAvailable();
        if (passageGenerator == null) {
            throw new GenerationUnavailableException("No passage generator is configured");
        }

        TestPlan plan = planner.plan(request);
        GeneratedContent content;
        try {
            content = passageGenerator.generate(plan.topic(), plan.language(), plan.complexity(), plan.targetWords(), plan.keypointCount());
        } catch (RuntimeException e) {
            log.warn("Passage generation failed for topic '{}': {}", plan.topic(), e.getMessage());
            throw new GenerationUnavailableException("Passage generation failed", e);
        }
        if (content == null) {
            throw new GenerationUnavailableException("Passage generator returned no content");
        }
        return store(build(plan, content));
    }

    public TestInstance find(String testId) {
        return repository.findById(testId).orElseThrow(() -> new TestNotFoundException(testId));
    }

    TestInstance build(TestPlan plan, GeneratedContent content) {
        if (content.passage() == null || content.passage().isBlank()) {
            throw new InvalidTestDefinitionException("Passage must not be blank");
        }
        if (content.keypoints() == null || content.keypoints().isEmpty()) {
            throw new InvalidTestDefinitionException("A test needs at least one keypoint");
        }

        List<Keypoint> keypoints = new ArrayList<>();
        for (int i = 0; i < content.keypoints().size(); i++) {
            String text = content.keypoints().get(i);
            if (text == null || text.isBlank()) {
                throw new InvalidTestDefinitionException("Keypoint " + i + " is blank");
            }
            List<String> tokens = engine.tokenizeKeypoint(text, plan.language());
            if (tokens.isEmpty()) {
                log.warn("Keypoint {} ('{}') has no significant tokens and can never be recalled", i, text);
            }
            keypoints.add(new Keypoint(i, text.trim(), tokens));
        }
        if (keypoints.size() != plan.keypointCount()) {
            log.debug("Test has {} keypoints, planned {}", keypoints.size(), plan.keypointCount());
        }

        return new TestInstance(UUID.randomUUID().toString(), plan.language(), plan.topic(), plan.complexity(),
                content.passage().trim(), keypoints, plan.targetWords(), plan.durationSec(),
                plan.normativeProfileId(), clock.instant());
    }

    private TestInstance store(TestInstance test) {
        repository.save(test);
        log.info("Registered test {} ({} keypoints, {} target words, profile {})",
                test.id(), test.keypoints().size(), test.targetWords(), test.normativeProfileId());
        return test;
    }
}
