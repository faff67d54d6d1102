package com.cheflink.agent;

import com.cheflink.agent.config.AgentProperties;
import com.cheflink.agent.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync(proxyTargetClass = true)
@EnableConfigurationProperties({AgentProperties.class, LlmProperties.class})
public class ChefLinkAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChefLinkAgentApplication.class, args);
    }
}
