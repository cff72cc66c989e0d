package com.zzf.agentdock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentDockApplication {
    private static final Logger logger = LoggerFactory.getLogger(AgentDockApplication.class);

    public static void main(String[] args) {
        logger.info("agentdock.boot java={} pid={}", System.getProperty("java.version"), ProcessHandle.current().pid());
        SpringApplication.run(AgentDockApplication.class, args);
    }
}
