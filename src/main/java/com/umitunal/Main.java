package com.umitunal;

import com.umitunal.examples.RunOnDemandExample;
import com.umitunal.examples.ScheduledJobsExample;

/**
 * Main class that runs all CronLite examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== CronLite Examples ===\n");

        ScheduledJobsExample.main(args);
        RunOnDemandExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
