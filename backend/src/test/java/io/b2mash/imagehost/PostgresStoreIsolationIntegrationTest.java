package io.b2mash.imagehost;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.testcontainers.junit.jupiter.Testcontainers;

/** The isolation scenario on a real PostgreSQL. Skipped when Docker is not available. */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@Testcontainers(disabledWithoutDocker = true)
class PostgresStoreIsolationIntegrationTest extends AbstractStoreIsolationScenario {}
