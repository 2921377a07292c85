package com.example.owlmon.config;

import com.example.owlmon.automaton.AutomatonBuilder;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    private ApplicationContextRunner runner(int threadPoolSize) {
        return new ApplicationContextRunner()
                .withUserConfiguration(AppConfig.class)
                .withBean(MonitorConfiguration.class, () -> {
                    MonitorConfiguration config = new MonitorConfiguration();
                    config.setThreadPoolSize(threadPoolSize);
                    return config;
                });
    }

    @Test
    void sequentialBuilderDoesNotStartAThreadPool() {
        runner(1).run(context -> {
            assertNotNull(context.getBean(AutomatonBuilder.class));
            assertFalse(context.getBeanFactory().containsSingleton("edgeCheckExecutor"));
        });
    }

    @Test
    void parallelBuilderGetsAThreadPool() {
        runner(4).run(context -> {
            assertNotNull(context.getBean(AutomatonBuilder.class));
            assertTrue(context.getBeanFactory().containsSingleton("edgeCheckExecutor"));
        });
    }
}
