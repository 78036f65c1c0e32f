package dev.regula.config;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtLoggingLevel;
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
 * Configures the ONNX Runtime environment before the in-process embedding model is created.
 *
 * <p>Implements {@link BeanFactoryPostProcessor} so that the {@link OrtEnvironment} singleton is
 * initialized with these threading options BEFORE Spring instantiates the {@code
 * BgeSmallEnV15QuantizedEmbeddingModel} bean. That bean's static initializer calls {@code
 * OrtEnvironment.getEnvironment()}, and the environment cannot be reconfigured afterwards.
 *
 * <p>Thread counts come from {@code regula.onnx.intra-op-threads} (default 4) and {@code
 * regula.onnx.inter-op-threads} (default 2); spinning is always disabled.
 */
@Configuration
@ConditionalOnProperty(
    name = "regula.embedding.provider",
    havingValue = "bge-small",
    matchIfMissing = true)
public class OnnxRuntimeConfig implements BeanFactoryPostProcessor, EnvironmentAware {

  private static final Logger log = LoggerFactory.getLogger(OnnxRuntimeConfig.class);

  private int intraOpThreads = 4;
  private int interOpThreads = 2;

  @Override
  public void setEnvironment(Environment environment) {
    this.intraOpThreads =
        environment.getProperty("regula.onnx.intra-op-threads", Integer.class, 4);
    this.interOpThreads =
        environment.getProperty("regula.onnx.inter-op-threads", Integer.class, 2);
  }

  @Override
  public void postProcessBeanFactory(ConfigurableListableBeanFactory beanFactory)
      throws BeansException {
    try (var threadingOptions = new OrtEnvironment.ThreadingOptions()) {
      threadingOptions.setGlobalSpinControl(false);
      threadingOptions.setGlobalIntraOpNumThreads(intraOpThreads);
      threadingOptions.setGlobalInterOpNumThreads(interOpThreads);

      OrtEnvironment.getEnvironment(
          OrtLoggingLevel.ORT_LOGGING_LEVEL_WARNING, "regula", threadingOptions);

      log.info(
          "ONNX Runtime initialized: spinning=off, intra-op={}, inter-op={}",
          intraOpThreads,
          interOpThreads);
    } catch (OrtException e) {
      throw new IllegalStateException("Failed to configure ONNX Runtime threading", e);
    } catch (IllegalStateException e) {
      log.warn(
          "ONNX Runtime environment already initialized, threading options not applied: {}",
          e.getMessage());
    }
  }
}
