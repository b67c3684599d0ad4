/* Repute © 2025 Repute Devs — MIT */
package dev.repute.admin;

import java.util.List;

/**
 * Per-ID outcome of a bulk removal, in request order.
 *
 * @param removed IDs reversed by this call
 * @param alreadyReversed IDs that were already reversed
 * @param notFound IDs the ledger does not know
 */
public record RemovalReport(
    List<String> removed, List<String> alreadyReversed, List<String> notFound) {

  public RemovalReport {
    removed = List.copyOf(removed);
    alreadyReversed = List.copyOf(alreadyReversed);
    notFound = List.copyOf(notFound);
  }
}
