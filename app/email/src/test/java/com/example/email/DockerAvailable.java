/*
 * どこで: Email 配信テスト基盤
 * 何を: Docker が使えない環境で Testcontainers を使うテストをスキップする条件
 * なぜ: Docker のない開発機でもユニットテストだけは実行できるようにするため
 */
package com.example.email;

import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.junit.jupiter.api.extension.ConditionEvaluationResult;
import org.junit.jupiter.api.extension.ExecutionCondition;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.testcontainers.DockerClientFactory;

@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@ExtendWith(DockerAvailable.DockerAvailableCondition.class)
public @interface DockerAvailable {

  class DockerAvailableCondition implements ExecutionCondition {

    @Override
    public ConditionEvaluationResult evaluateExecutionCondition(ExtensionContext context) {
      try {
        DockerClientFactory.instance().client();
        return ConditionEvaluationResult.enabled("Docker is available");
      } catch (Throwable t) {
        return ConditionEvaluationResult.disabled("Docker is not available: " + t.getMessage());
      }
    }
  }
}
