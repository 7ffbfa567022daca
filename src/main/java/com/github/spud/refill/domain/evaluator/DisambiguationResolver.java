package com.github.spud.refill.domain.evaluator;

import java.util.List;

/**
 * 药品索引相似度检索
 */
public interface DisambiguationResolver {

  /**
   * @return 按相似度降序的候选，无匹配时为空
   */
  List<DrugCandidate> resolve(String freeText);
}
