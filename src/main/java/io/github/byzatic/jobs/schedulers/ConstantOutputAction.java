package io.github.byzatic.jobs.schedulers;

import io.github.byzatic.jobs.job_store.Job;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Placeholder action: logs the run and returns a fixed output.
 */
public final class ConstantOutputAction implements JobAction {
    private final static Logger logger = LoggerFactory.getLogger(ConstantOutputAction.class);
    public static final String DEFAULT_OUTPUT = "Hello World";

    private final String output;

    public ConstantOutputAction() {
        this(DEFAULT_OUTPUT);
    }

    public ConstantOutputAction(@NotNull String output) {
        this.output = Objects.requireNonNull(output, "output must not be null");
    }

    @Override
    public String execute(@NotNull Job job) {
        logger.info("Ran job: {}", job.getName());
        return output;
    }
}
