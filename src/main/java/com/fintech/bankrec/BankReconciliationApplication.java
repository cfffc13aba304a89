package com.fintech.bankrec;

import com.fintech.bankrec.cli.ReconciliationCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;

/**
 * Bank Reconciliation Service
 * <p>
 * Links bank statement lines to the receipts that explain them.
 * <p>
 * Key Features:
 * - Tolerance-based one-to-one matching with confidence scores
 * - Split groups where several receipts explain one bank line, or the reverse
 * - Duplicate receipt detection that protects recurring charges and bank fees
 * - Idempotent CSV imports
 * - Append-only audit log of every change
 * <p>
 * Started with a command ({@code reconcile}, {@code import-receipts}, {@code import-transactions})
 * it runs once and exits; without one it serves the REST API.
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class BankReconciliationApplication {

    public static void main(String[] args) {
        boolean oneShot = Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--"));

        SpringApplication application = new SpringApplication(BankReconciliationApplication.class);
        if (oneShot) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(args);

        if (context.getBean(ReconciliationCommandLineRunner.class).isCommandExecuted()) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
