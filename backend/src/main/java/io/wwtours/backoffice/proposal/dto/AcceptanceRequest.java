package io.wwtours.backoffice.proposal.dto;

/**
 * Client signature submitted with an acceptance. {@code ipAddress} is filled in from the request,
 * never taken from the body.
 */
public record AcceptanceRequest(
    String signature,
    String signerName,
    String signerEmail,
    boolean gratuityAccepted,
    String ipAddress) {

  public AcceptanceRequest withIpAddress(String ipAddress) {
    return new AcceptanceRequest(signature, signerName, signerEmail, gratuityAccepted, ipAddress);
  }
}
