package io.herald4j.core;

public class JobNotFoundException extends HeraldException {

    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " not found");
    }
}
