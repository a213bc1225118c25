package io.wwtours.backoffice.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class PaymentNotVerifiedException extends ErrorResponseException {

  public PaymentNotVerifiedException(UUID proposalId, String paymentReference, String detail) {
    super(HttpStatus.PAYMENT_REQUIRED, createProblem(proposalId, paymentReference, detail), null);
  }

  private static ProblemDetail createProblem(
      UUID proposalId, String paymentReference, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.PAYMENT_REQUIRED);
    problem.setTitle("Payment not verified");
    problem.setDetail(detail);
    problem.setProperty("kind", "PaymentNotVerified");
    problem.setProperty("proposalId", proposalId != null ? proposalId.toString() : null);
    problem.setProperty("paymentReference", paymentReference);
    return problem;
  }
}
