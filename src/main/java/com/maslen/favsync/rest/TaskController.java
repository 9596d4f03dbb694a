package com.maslen.favsync.rest;

import com.maslen.favsync.dto.PageResult;
import com.maslen.favsync.dto.StatusOverrideRequest;
import com.maslen.favsync.dto.SubmitResponse;
import com.maslen.favsync.dto.TaskRequest;
import com.maslen.favsync.dto.TaskView;
import com.maslen.favsync.exceptions.BadRequestException;
import com.maslen.favsync.exceptions.NotFoundException;
import com.maslen.favsync.model.TaskStatus;
import com.maslen.favsync.service.TaskAdmissionService;
import com.maslen.favsync.service.TaskStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class TaskController {

    static final int MAX_PAGE_SIZE = 100;

    private final TaskAdmissionService admissionService;
    private final TaskStore taskStore;

    @PostMapping("/task/bili")
    public SubmitResponse submit(@RequestBody TaskRequest request) {
        TaskAdmissionService.Admission admission = admissionService.submit(request.getBid(), request.getFavid());
        String message = switch (admission.getOutcome()) {
            case CREATED -> "Task " + request.getBid() + " added to database";
            case UPDATED -> "Task " + request.getBid() + " is already queued, payload updated";
            case REQUEUED -> "Task " + request.getBid() + " requeued";
        };
        return new SubmitResponse(admission.getOutcome().getValue(), message, TaskView.of(admission.getTask()));
    }

    @GetMapping("/tasks/status")
    public Map<String, Long> stats() {
        Map<String, Long> result = new LinkedHashMap<>();
        taskStore.stats().forEach((status, count) -> result.put(status.getValue(), count));
        return result;
    }

    @GetMapping("/tasks")
    public PageResult<TaskView> list(
            @RequestParam(name = "page", defaultValue = "1") int page,
            @RequestParam(name = "page_size", defaultValue = "20") int pageSize,
            @RequestParam(name = "status", required = false) String status) {
        if (page < 1) {
            throw new BadRequestException("invalid-page", "page must be at least 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new BadRequestException("invalid-page_size", "page_size must be between 1 and " + MAX_PAGE_SIZE);
        }
        TaskStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = TaskStatus.fromValue(status);
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("invalid-status", e.getMessage());
            }
        }
        return taskStore.paginate(page, pageSize, filter).map(TaskView::of);
    }

    @GetMapping("/tasks/{id}")
    public TaskView get(@PathVariable("id") Long id) {
        return taskStore.findById(id).map(TaskView::of)
                .orElseThrow(() -> new NotFoundException("task", String.valueOf(id)));
    }

    @PutMapping("/tasks/{id}/status")
    public TaskView overrideStatus(@PathVariable("id") Long id, @RequestBody StatusOverrideRequest request) {
        return TaskView.of(admissionService.overrideStatus(id, request.getStatus(), request.getErrorMessage()));
    }

    @DeleteMapping("/tasks/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("id") Long id) {
        admissionService.delete(id);
    }
}
