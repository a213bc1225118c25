package io.wwtours.backoffice.proposal;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/** Client signature captured at acceptance. Written once, together with the ACCEPTED status. */
@Embeddable
public class AcceptanceRecord {

  @Column(name = "accepted_signature", length = 2000)
  private String signature;

  @Column(name = "accepted_by_name", length = 200)
  private String signerName;

  @Column(name = "accepted_by_email", length = 255)
  private String signerEmail;

  @Column(name = "accepted_ip_address", length = 45)
  private String ipAddress;

  @Column(name = "gratuity_accepted")
  private Boolean gratuityAccepted;

  protected AcceptanceRecord() {}

  public AcceptanceRecord(
      String signature,
      String signerName,
      String signerEmail,
      String ipAddress,
      boolean gratuityAccepted) {
    this.signature = signature;
    this.signerName = signerName;
    this.signerEmail = signerEmail;
    this.ipAddress = ipAddress;
    this.gratuityAccepted = gratuityAccepted;
  }

  public String getSignature() {
    return signature;
  }

  public String getSignerName() {
    return signerName;
  }

  public String getSignerEmail() {
    return signerEmail;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public boolean isGratuityAccepted() {
    return Boolean.TRUE.equals(gratuityAccepted);
  }
}
