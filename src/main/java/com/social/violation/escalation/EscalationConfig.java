package com.social.violation.escalation;

import com.social.violation.core.escalation.EscalationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ModerationProperties.class)
public class EscalationConfig {

    private static final Logger log = LoggerFactory.getLogger(EscalationConfig.class);

    @Bean
    public EscalationPolicy escalationPolicy(ModerationProperties props) {
        EscalationPolicy policy = new EscalationPolicy(props.getBanThreshold());
        log.info("Escalation policy: ban at {} violation(s)", policy.banThreshold());
        return policy;
    }
}
