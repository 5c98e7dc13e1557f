package com.sitecam.timelapse;

import com.google.inject.AbstractModule;
import com.google.inject.BindingAnnotation;
import com.google.inject.Provides;
import com.sitecam.timelapse.config.Config;
import com.sitecam.timelapse.config.ConfigProvider;
import com.sitecam.timelapse.encoder.FfmpegMediaEncoder;
import com.sitecam.timelapse.encoder.MediaEncoder;
import com.sitecam.timelapse.source.ObjectStorageRawInputSource;
import com.sitecam.timelapse.source.RawInputSource;
import com.sitecam.timelapse.storage.AsyncStorageClient;
import com.sitecam.timelapse.storage.GCSAsyncStorageClient;
import com.sitecam.timelapse.storage.LocalArtifactStore;
import com.sitecam.timelapse.storage.ObjectStorageRemoteArtifactStore;
import com.sitecam.timelapse.storage.RemoteArtifactStore;
import com.sitecam.timelapse.storage.S3AsyncStorageClient;
import com.sitecam.timelapse.storage.StorageUtils;
import com.sitecam.timelapse.storage.providers.GcsClientProvider;
import com.sitecam.timelapse.storage.providers.S3AsyncClientProvider;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Slf4j
public class RuntimeModule extends AbstractModule {
  private static final Logger logger = LoggerFactory.getLogger(RuntimeModule.class);
  private static final int IO_WORKLOAD_NUM_THREAD_MULTIPLIER = 5;
  private final Config config;

  public RuntimeModule(Config config) {
    this.config = config;
  }

  @Retention(RetentionPolicy.RUNTIME)
  @BindingAnnotation
  public @interface RawInputObjectStorageAsyncClient {}

  @Retention(RetentionPolicy.RUNTIME)
  @BindingAnnotation
  public @interface ArtifactObjectStorageAsyncClient {}

  @Provides
  @Singleton
  @RawInputObjectStorageAsyncClient
  static AsyncStorageClient providesAsyncStorageClientForRawInput(
      Config config,
      StorageUtils storageUtils,
      S3AsyncClientProvider s3AsyncClientProvider,
      GcsClientProvider gcsClientProvider,
      ExecutorService executorService) {
    return storageClientFor(
        config.getSourceConfig().getRootUri(),
        storageUtils,
        s3AsyncClientProvider,
        gcsClientProvider,
        executorService);
  }

  @Provides
  @Singleton
  @ArtifactObjectStorageAsyncClient
  static AsyncStorageClient providesAsyncStorageClientForArtifacts(
      Config config,
      StorageUtils storageUtils,
      S3AsyncClientProvider s3AsyncClientProvider,
      GcsClientProvider gcsClientProvider,
      ExecutorService executorService) {
    return storageClientFor(
        config.getArtifactStoreConfig().getRemoteBaseUri(),
        storageUtils,
        s3AsyncClientProvider,
        gcsClientProvider,
        executorService);
  }

  // the source and the artifact store may live on different providers
  private static AsyncStorageClient storageClientFor(
      String uri,
      StorageUtils storageUtils,
      S3AsyncClientProvider s3AsyncClientProvider,
      GcsClientProvider gcsClientProvider,
      ExecutorService executorService) {
    if (storageUtils.isGcsUri(uri)) {
      return new GCSAsyncStorageClient(gcsClientProvider, storageUtils, executorService);
    }
    return new S3AsyncStorageClient(s3AsyncClientProvider, storageUtils, executorService);
  }

  @Provides
  @Singleton
  static S3AsyncClientProvider providesS3AsyncClientProvider(
      Config config, ExecutorService executorService) {
    return new S3AsyncClientProvider(config, executorService);
  }

  @Provides
  @Singleton
  static GcsClientProvider providesGcsClientProvider(Config config) {
    return new GcsClientProvider(config);
  }

  @Provides
  @Singleton
  static LocalArtifactStore providesLocalArtifactStore(Config config) {
    return new LocalArtifactStore(
        Paths.get(config.getArtifactStoreConfig().getLocalBaseDir()).toAbsolutePath());
  }

  @Provides
  @Singleton
  static ConfigProvider configProvider(Config config) {
    return new ConfigProvider(config);
  }

  @Provides
  @Singleton
  static Clock providesClock() {
    return Clock.systemDefaultZone();
  }

  @Provides
  @Singleton
  static ExecutorService providesExecutorService() {
    // more threads as most operation are IO intensive workload
    int numThreads = Runtime.getRuntime().availableProcessors() * IO_WORKLOAD_NUM_THREAD_MULTIPLIER;
    log.info("Spinning up {} threads", numThreads);
    class ApplicationThreadFactory implements ForkJoinPool.ForkJoinWorkerThreadFactory {
      private static final String THREAD_GROUP_NAME_TEMPLATE = "timelapse-builder-%d";
      private final AtomicInteger counter = new AtomicInteger(1);

      @Override
      public ForkJoinWorkerThread newThread(ForkJoinPool pool) {
        return new ForkJoinWorkerThread(pool) {
          {
            setName(String.format(THREAD_GROUP_NAME_TEMPLATE, counter.getAndIncrement()));
          }
        };
      }
    }

    return new ForkJoinPool(
        numThreads,
        new ApplicationThreadFactory(),
        (thread, throwable) -> {
          if (throwable != null) {
            logger.error(
                String.format("Uncaught exception in a thread (%s)", thread.getName()), throwable);
          }
        },
        // NOTE: asyncMode must stay true, the pool only runs CompletableFuture stages
        true);
  }

  @Override
  protected void configure() {
    bind(Config.class).toInstance(config);
    bind(RawInputSource.class).to(ObjectStorageRawInputSource.class);
    bind(RemoteArtifactStore.class).to(ObjectStorageRemoteArtifactStore.class);
    bind(MediaEncoder.class).to(FfmpegMediaEncoder.class);
  }
}
