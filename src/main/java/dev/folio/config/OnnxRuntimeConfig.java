package dev.folio.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
import dev.folio.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.EnvironmentAware;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Configures the ONNX Runtime environment before the embedding and scoring model beans exist.
 *
 * <p>{@link OrtEnvironment} is a process-wide singleton that cannot be reconfigured once created,
 * and the bge-small model creates it in its static initializer. Running as a {@link
 * BeanFactoryPostProcessor} guarantees the threading options are applied first. Thread counts come
 * from {@code folio.onnx.*}; the retrieval pool already parallelises across queries, so the
 * defaults stay small.
 */
@Configuration
@ConditionalOnProperty(
    name = "folio.onnx.configure-threading",
    havingValue = "true",
    matchIfMissing = true)
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private OnnxThreading threading = OnnxThreading.DEFAULT;

  @Override
  public void setEnvironment(Environment environment) {
    this.threading = OnnxThreading.from(environment);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(threading.spinning());
      threadingOptions.setGlobalIntraOpNumThreads(threading.intraOpThreads());
      threadingOptions.setGlobalInterOpNumThreads(threading.interOpThreads());

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "folio", threadingOptions);

      log.info("ONNX Runtime initialized: {}", threading);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment was created before Spring startup, threading options not"
              + " applied: {}",
          e.getMessage());
    }
  }

  /**
   * Global ONNX Runtime thread settings.
   *
   * @param intraOpThreads threads inside one inference operation
   * @param interOpThreads threads across independent operations
   * @param spinning whether idle worker threads spin
   */
  record OnnxThreading(int intraOpThreads, int interOpThreads, boolean spinning) {

    static final OnnxThreading DEFAULT = new OnnxThreading(4, 2, false);

    OnnxThreading {
      if (intraOpThreads < 1 || interOpThreads < 1) {
        throw new ConfigurationException(
            "folio.onnx thread counts must be at least 1, got intra-op="
                + intraOpThreads
                + ", inter-op="
                + interOpThreads);
      }
    }

    static OnnxThreading from(Environment environment) {
      return new OnnxThreading(
          environment.getProperty(
              "folio.onnx.intra-op-threads", Integer.class, DEFAULT.intraOpThreads()),
          environment.getProperty(
              "folio.onnx.inter-op-threads", Integer.class, DEFAULT.interOpThreads()),
          environment.getProperty("folio.onnx.spinning", Boolean.class, DEFAULT.spinning()));
    }
  }
}
