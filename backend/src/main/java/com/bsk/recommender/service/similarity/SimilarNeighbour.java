package com.bsk.recommender.service.similarity;

import lombok.Value;

/** A service and its cosine similarity to the anchor, in [-1, 1]. */
@Value
public class SimilarNeighbour {
  int serviceId;
  double score;
}
