package com.bsk.recommender.service.recommendation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a fixed number of content suggestions across the anchor services of one request.
 *
 * <p>The selected service receives its share first (capped at the total); what is left is divided
 * evenly over the remaining anchors in order, with the remainder going to the earliest ones.
 * Without a selection the whole budget is divided evenly.
 */
public final class AnchorBudget {

  private AnchorBudget() {}

  /**
   * @param anchors distinct anchor service ids in presentation order
   * @param selectedServiceId the selected anchor, null when there is none
   * @return suggestions per anchor in anchor order; anchors left without budget map to 0
   */
  public static Map<Integer, Integer> allocate(
      List<Integer> anchors, Integer selectedServiceId, int total, int selectedShare) {
    Map<Integer, Integer> budget = new LinkedHashMap<>();
    if (anchors.isEmpty() || total <= 0) {
      anchors.forEach(anchor -> budget.put(anchor, 0));
      return budget;
    }

    int remaining = total;
    List<Integer> others = anchors;
    if (selectedServiceId != null && anchors.contains(selectedServiceId)) {
      int selected = Math.min(Math.max(selectedShare, 0), total);
      remaining = total - selected;
      others = anchors.stream().filter(anchor -> !anchor.equals(selectedServiceId)).toList();
      for (Integer anchor : anchors) {
        budget.put(anchor, anchor.equals(selectedServiceId) ? selected : 0);
      }
    }

    if (!others.isEmpty()) {
      int base = remaining / others.size();
      int extra = remaining % others.size();
      for (int i = 0; i < others.size(); i++) {
        budget.put(others.get(i), base + (i < extra ? 1 : 0));
      }
    }
    return budget;
  }
}
