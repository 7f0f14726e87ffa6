package com.flamingo.ai.redline.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.redline.api.rest.DocumentController;
import com.flamingo.ai.redline.api.rest.HealthController;
import java.lang.reflect.Method;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify the public routes.
 *
 * <ul>
 *   <li>GET /health and GET /v1/health - Liveness
 *   <li>POST /v1/read - Document structure
 *   <li>POST /v1/apply - Apply or dry-run edits
 * </ul>
 */
class ApiContractTest {

  private static Method method(Class<?> type, String name) {
    for (Method method : type.getDeclaredMethods()) {
      if (method.getName().equals(name)) {
        return method;
      }
    }
    throw new AssertionError("No method " + name + " on " + type.getSimpleName());
  }

  @Nested
  @DisplayName("DocumentController API contract")
  class DocumentControllerContract {

    @Test
    @DisplayName("should be mapped under /v1")
    void shouldBeMappedUnderV1() {
      RequestMapping mapping = DocumentController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/v1");
    }

    @Test
    @DisplayName("should expose multipart POST /read and /apply")
    void shouldExposeReadAndApply() {
      PostMapping read = method(DocumentController.class, "read").getAnnotation(PostMapping.class);
      PostMapping apply = method(DocumentController.class, "apply").getAnnotation(PostMapping.class);

      assertThat(read.value()).containsExactly("/read");
      assertThat(apply.value()).containsExactly("/apply");
      assertThat(read.consumes()).containsExactly("multipart/form-data");
      assertThat(apply.consumes()).containsExactly("multipart/form-data");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should answer on /health and /v1/health")
    void shouldAnswerOnBothHealthPaths() {
      GetMapping mapping = method(HealthController.class, "health").getAnnotation(GetMapping.class);
      assertThat(mapping.value()).containsExactlyInAnyOrder("/health", "/v1/health");
    }
  }
}
