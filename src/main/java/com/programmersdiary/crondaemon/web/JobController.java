package com.programmersdiary.crondaemon.web;

import com.programmersdiary.crondaemon.scheduling.JobNotFoundException;
import com.programmersdiary.crondaemon.scheduling.JobResult;
import com.programmersdiary.crondaemon.scheduling.JobScope;
import com.programmersdiary.crondaemon.scheduling.ScheduledJob;
import com.programmersdiary.crondaemon.scheduling.ScheduledJobExecutor;
import com.programmersdiary.crondaemon.scheduling.ScheduledJobService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private static final String API_LINEAGE = "api";

    private final ScheduledJobService jobService;
    private final ScheduledJobExecutor jobExecutor;

    public JobController(ScheduledJobService jobService, ScheduledJobExecutor jobExecutor) {
        this.jobService = jobService;
        this.jobExecutor = jobExecutor;
    }

    @GetMapping
    public List<ScheduledJob> listJobs(@RequestParam(defaultValue = "false") boolean includeDisabled) {
        return jobService.list(includeDisabled);
    }

    @GetMapping("/{id}")
    public ScheduledJob getJob(@PathVariable long id) {
        try {
            return jobService.get(id);
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ScheduledJob createJob(@RequestBody CreateJobRequest request) {
        try {
            return jobService.create(request.cronExpression(), request.task(), request.message(),
                    JobScope.parse(request.scope()), API_LINEAGE);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void cancelJob(@PathVariable long id) {
        try {
            jobService.cancel(id);
        } catch (JobNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping("/results")
    public List<JobResult> getResults() {
        return jobExecutor.recentResults();
    }
}
