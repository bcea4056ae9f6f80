package io.b2mash.imagehost;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class StoreIsolationScenarioIntegrationTest extends AbstractStoreIsolationScenario {}
