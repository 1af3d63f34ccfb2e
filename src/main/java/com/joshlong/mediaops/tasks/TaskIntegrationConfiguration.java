package com.joshlong.mediaops.tasks;

import com.joshlong.mediaops.MediaOpsProperties;
import com.joshlong.mediaops.media.MediaService;
import com.joshlong.mediaops.notifications.Notifier;
import com.joshlong.mediaops.storage.ObjectStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.integration.dsl.DirectChannelSpec;
import org.springframework.integration.dsl.ExecutorChannelSpec;
import org.springframework.integration.dsl.IntegrationFlow;
import org.springframework.integration.dsl.MessageChannels;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.messaging.MessageChannel;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * submissions are queued on an executor channel whose workers run one task each. A worker
 * that fails sends the message to the dead letter channel named in its
 * {@link org.springframework.messaging.MessageHeaders#ERROR_CHANNEL error channel} header.
 */
@Configuration
class TaskIntegrationConfiguration {

	static final String DEAD_LETTER_CHANNEL_NAME = "deadLetterChannel";

	@Bean
	JdbcTaskStore jdbcTaskStore(JdbcClient db) {
		return new JdbcTaskStore(db, Clock.systemUTC());
	}

	@Bean
	ThreadPoolTaskExecutor taskWorkers(MediaOpsProperties properties) {
		return pool("task-", properties.tasks().workers());
	}

	@Bean
	ThreadPoolTaskExecutor pipelineWorkers(MediaOpsProperties properties) {
		return pool("pipeline-", properties.tasks().workers());
	}

	private static ThreadPoolTaskExecutor pool(String prefix, int workers) {
		var executor = new ThreadPoolTaskExecutor();
		executor.setThreadNamePrefix(prefix);
		executor.setCorePoolSize(workers);
		executor.setMaxPoolSize(workers);
		return executor;
	}

	@Bean
	@TaskExecutionMessageChannel
	ExecutorChannelSpec taskExecutionRequests(ThreadPoolTaskExecutor taskWorkers) {
		return MessageChannels.executor(taskWorkers);
	}

	@Bean(DEAD_LETTER_CHANNEL_NAME)
	@DeadLetterMessageChannel
	DirectChannelSpec deadLetterChannel() {
		return MessageChannels.direct();
	}

	@Bean
	DefaultTaskService taskService(MediaService mediaService, TaskStore taskStore,
			@TaskExecutionMessageChannel MessageChannel requests, MediaOpsProperties properties) {
		var storage = properties.storage();
		return new DefaultTaskService(mediaService, taskStore, requests, DEAD_LETTER_CHANNEL_NAME, storage.bucket(),
				targetBucket(storage), storage.targetPrefix());
	}

	@Bean
	TaskRunner taskRunner(MediaService mediaService, ObjectStore objectStore, TaskStore taskStore,
			ThreadPoolTaskExecutor pipelineWorkers, MediaOpsProperties properties) {
		return new TaskRunner(mediaService, objectStore, taskStore, pipelineWorkers, properties.tasks().timeout(),
				properties.storage().targetPrefix());
	}

	@Bean
	DeadLetterProcessor deadLetterProcessor(TaskStore taskStore, Notifier notifier) {
		return new DeadLetterProcessor(taskStore, notifier);
	}

	@Bean
	IntegrationFlow taskExecutionIntegrationFlow(@TaskExecutionMessageChannel MessageChannel inbound,
			TaskRunner runner) {
		return IntegrationFlow //
			.from(inbound) //
			.handle(TaskExecutionRequest.class, (payload, headers) -> { //
				runner.run(payload);
				return null;
			}) //
			.get();
	}

	@Bean
	IntegrationFlow deadLetterIntegrationFlow(@DeadLetterMessageChannel MessageChannel deadLetters,
			DeadLetterProcessor processor) {
		return IntegrationFlow //
			.from(deadLetters) //
			.handle(Throwable.class, (payload, headers) -> { //
				processor.onMessage(DeadLetter.from(payload));
				return null;
			}) //
			.get();
	}

	private static String targetBucket(MediaOpsProperties.Storage storage) {
		var target = storage.targetBucket();
		return target == null || target.isBlank() ? storage.bucket() : target;
	}

}
