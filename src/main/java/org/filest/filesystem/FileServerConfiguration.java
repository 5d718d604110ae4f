package org.filest.filesystem;

import org.filest.upload.ChunkSessionSweeper;
import org.filest.upload.ChunkedUploadService;
import org.filest.upload.DirectUploadService;
import org.filest.upload.UploadSessionStore;
import org.filest.web.BasicAuthFilter;
import org.filest.web.CredentialVerifier;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * 文件传输服务的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把配置 {@link FileServerProperties} 注入到路径解析器、会话存储与各上传服务中。</li>
 *   <li>会话存储随容器创建与销毁；停机时 {@link ChunkedUploadService#shutdown()} 清理未完成会话的暂存目录。</li>
 *   <li>这里不引入任何数据库/外部依赖，全部基于本地文件系统。</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class FileServerConfiguration {

    @Bean
    public SandboxPathResolver sandboxPathResolver(FileServerProperties properties) {
        return new SandboxPathResolver(properties);
    }

    @Bean
    public UploadSessionStore uploadSessionStore() {
        return new UploadSessionStore();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ChunkedUploadService chunkedUploadService(
            SandboxPathResolver pathResolver,
            UploadSessionStore sessionStore,
            FileServerProperties properties,
            Clock clock
    ) {
        return new ChunkedUploadService(pathResolver, sessionStore, properties, clock);
    }

    @Bean
    public DirectUploadService directUploadService(SandboxPathResolver pathResolver, FileServerProperties properties) {
        return new DirectUploadService(pathResolver, properties);
    }

    @Bean
    public CredentialVerifier credentialVerifier(FileServerProperties properties) {
        return new CredentialVerifier(properties.getUsername(), properties.getPassword());
    }

    @Bean
    public FilterRegistrationBean<BasicAuthFilter> basicAuthFilter(CredentialVerifier credentialVerifier) {
        FilterRegistrationBean<BasicAuthFilter> registration = new FilterRegistrationBean<>(new BasicAuthFilter(credentialVerifier));
        registration.addUrlPatterns("/api/*");
        registration.setOrder(0);
        return registration;
    }

    @Bean
    public ThreadPoolTaskScheduler sweepTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("chunk-sweep-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ChunkSessionSweeper chunkSessionSweeper(
            ChunkedUploadService uploadService,
            @Qualifier("sweepTaskScheduler") ThreadPoolTaskScheduler sweepTaskScheduler,
            FileServerProperties properties
    ) {
        return new ChunkSessionSweeper(uploadService, sweepTaskScheduler, properties.getChunkSweepInterval());
    }
}
