package com.incidentradar.analytics.api;

import com.incidentradar.analytics.evaluation.AssignmentCompletionGuard;
import com.incidentradar.analytics.evaluation.EvaluationTaskService;
import com.incidentradar.analytics.evaluation.HumanEvaluationSubmission;
import com.incidentradar.analytics.evaluation.SubmissionOutcome;
import com.incidentradar.analytics.model.EvaluationTask;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the human evaluation workflow.
 */
@RestController
@RequestMapping("/api/evaluations")
public class EvaluationController {
  private final AssignmentCompletionGuard completionGuard;
  private final EvaluationTaskService taskService;

  public EvaluationController(
      AssignmentCompletionGuard completionGuard, EvaluationTaskService taskService) {
    this.completionGuard = completionGuard;
    this.taskService = taskService;
  }

  /**
   * Submits a human evaluation and completes the matching assignment.
   *
   * @param submission evaluation payload
   * @return confirmation payload; a missing or completed assignment yields HTTP 404
   */
  @PostMapping
  public Map<String, String> submit(@RequestBody HumanEvaluationSubmission submission) {
    SubmissionOutcome outcome = completionGuard.submit(submission);
    if (outcome == SubmissionOutcome.NOT_FOUND_OR_ALREADY_COMPLETE) {
      throw new AssignmentNotPendingException(
          submission.classificationResultId(), submission.evaluatorId());
    }
    return Map.of("status", "submitted", "message", "Evaluation submitted");
  }

  @GetMapping("/next/{evaluatorId}")
  public EvaluationTask next(@PathVariable("evaluatorId") String evaluatorId) {
    return taskService.nextTask(evaluatorId)
        .orElseThrow(() -> new NotFoundException("No pending assignment for evaluator " + evaluatorId));
  }
}
