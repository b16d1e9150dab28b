package com.cascade.spring;

import com.cascade.adapter.spring.CascadeAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable Cascade rule processing in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableCascade
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 * Provide a {@link com.cascade.dispatch.WorkItemGateway} bean to connect to a
 * real work tracking system.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(CascadeAutoConfiguration.class)
public @interface EnableCascade {
}
