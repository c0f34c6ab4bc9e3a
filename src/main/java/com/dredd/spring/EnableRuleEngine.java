package com.dredd.spring;

import com.dredd.adapter.spring.RuleEngineAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the rule engine in a Spring application that does not rely on auto-configuration.
 *
 * Usage:
 * <pre>
 * &#64;Configuration
 * &#64;EnableRuleEngine
 * public class RulesConfiguration {
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(RuleEngineAutoConfiguration.class)
public @interface EnableRuleEngine {
}
