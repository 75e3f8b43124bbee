package com.netsim.telemetry.functional.steps;

import io.cucumber.java.After;
import io.cucumber.java.Before;
import io.cucumber.java.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scenario hooks shared across all feature files.
 */
public class CommonSteps {

    private static final Logger log = LoggerFactory.getLogger(CommonSteps.class);
    private final TestContext context;

    public CommonSteps() {
        this.context = SharedTestContext.get();
    }

    // ===== LIFECYCLE HOOKS =====

    @Before
    public void setUp(Scenario scenario) {
        log.info("--- Scenario starting: {} ---", scenario.getName());
    }

    @After
    public void tearDown(Scenario scenario) {
        if (scenario.isFailed() && context.getReport() != null) {
            scenario.log("Report at failure: " + context.getReport());
        }
        context.cleanup();
        log.info("--- Scenario complete ---");
    }
}
