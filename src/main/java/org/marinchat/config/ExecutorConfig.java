package org.marinchat.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // une tâche d'écriture par connexion vivante
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService wsWriterExecutor() {
        CustomizableThreadFactory tf = new CustomizableThreadFactory("ws-writer-");
        tf.setDaemon(true);
        return Executors.newCachedThreadPool(tf);
    }
}
