/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.catalog.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Logical name of one independently-owned relational service. */
@RequiredArgsConstructor
public enum ServiceIdentifier {
  WALLET("wallet"),
  BETS_HISTORY("bets-history"),
  USER_ACTIVITIES("user-activities"),
  FINANCIAL_HISTORY("financial-history"),
  AFFILIATE("affiliate"),
  CASINO_ST8("casino-st8"),
  GEOLOCATION("geolocation"),
  KYC("kyc"),
  NOTIFICATION("notification"),
  OPTIMOVE("optimove"),
  PAM("pam"),
  PAYMENT_GATEWAY("payment-gateway"),
  TRAFFIC("traffic");

  @Getter @JsonValue private final String serviceName;

  public static Optional<ServiceIdentifier> find(String name) {
    return Arrays.stream(values())
        .filter(service -> service.serviceName.equalsIgnoreCase(name))
        .findFirst();
  }

  /**
   * Resolve a service by its logical name, ignoring case.
   *
   * @throws IllegalArgumentException for a name outside the known set
   */
  @JsonCreator
  public static ServiceIdentifier fromName(String name) {
    return find(name)
        .orElseThrow(() -> new IllegalArgumentException("Unknown database service: " + name));
  }

  @Override
  public String toString() {
    return serviceName;
  }
}
