package com.cascade;

import com.cascade.core.TriggerProcessor;
import com.cascade.core.TriggerResult;
import com.cascade.core.WorkItemFactory;
import com.cascade.dispatch.InMemoryWorkItemGateway;
import com.cascade.dispatch.PatchRequest;
import com.cascade.dispatch.JsonPatchWriter;
import com.cascade.dispatch.WorkItemGateway;
import com.cascade.spring.EnableCascade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application demonstrating Cascade usage.
 * Seeds the in-memory store with a small hierarchy and simulates a change.
 */
@SpringBootApplication
@EnableCascade
public class CascadeApplication {

    private static final Logger log = LoggerFactory.getLogger(CascadeApplication.class);

    private static final String BASE_URL = "https://dev.azure.com/org/project/_apis/wit/workItems/";

    public static void main(String[] args) {
        SpringApplication.run(CascadeApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(TriggerProcessor processor, WorkItemGateway gateway) {
        return args -> {
            if (!(gateway instanceof InMemoryWorkItemGateway store)) {
                log.info("Demo skipped: a real WorkItemGateway is configured");
                return;
            }
            log.info("=== Cascade Demo Started ===");

            store.save(WorkItemFactory.fromJson(story()));
            store.save(WorkItemFactory.fromJson(task(123, "Dev Task: Implement user login", "Active",
                    "John Developer", "john.developer@company.com")));
            store.save(WorkItemFactory.fromJson(task(124, "Test Task: User login tests", "New",
                    "Jane Tester", "jane.tester@company.com")));
            store.save(WorkItemFactory.fromJson(task(125, "Release Task: Deploy login feature", "New",
                    "Bob Deployer", "bob.deployer@company.com")));

            TriggerResult result = processor.process(BASE_URL + 123);
            log.info("Result: {} - {}", result.status(), result.message());
            for (PatchRequest patch : result.patches()) {
                log.info("PATCH {} {} {}", patch.url(), JsonPatchWriter.queryParameters(patch),
                        JsonPatchWriter.writeBody(patch));
            }

            log.info("=== Cascade Demo Completed ===");
        };
    }

    private static String story() {
        return """
            {
                "id": 100,
                "url": "%1$s100",
                "fields": {
                    "System.Title": "User Story: User Authentication",
                    "System.State": "New",
                    "System.WorkItemType": "User Story",
                    "System.Tags": ""
                },
                "relations": [
                    {"rel": "System.LinkTypes.Hierarchy-Forward", "url": "%1$s123", "attributes": {"name": "Child"}},
                    {"rel": "System.LinkTypes.Hierarchy-Forward", "url": "%1$s124", "attributes": {"name": "Child"}},
                    {"rel": "System.LinkTypes.Hierarchy-Forward", "url": "%1$s125", "attributes": {"name": "Child"}}
                ]
            }
            """.formatted(BASE_URL);
    }

    private static String task(int id, String title, String state, String displayName, String uniqueName) {
        return """
            {
                "id": %2$d,
                "url": "%1$s%2$d",
                "fields": {
                    "System.Title": "%3$s",
                    "System.State": "%4$s",
                    "System.WorkItemType": "Task",
                    "System.AssignedTo": {"displayName": "%5$s", "uniqueName": "%6$s"},
                    "System.Tags": ""
                },
                "relations": [
                    {"rel": "System.LinkTypes.Hierarchy-Reverse", "url": "%1$s100", "attributes": {"name": "Parent"}}
                ]
            }
            """.formatted(BASE_URL, id, title, state, displayName, uniqueName);
    }
}
