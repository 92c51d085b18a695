package org.springaicommunity.dependency.updater;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for creating a consistently configured {@link ObjectMapper}.
 *
 * <p>
 * Job documents use kebab-case keys, so the returned mapper uses
 * {@link PropertyNamingStrategies#KEBAB_CASE} (e.g.&nbsp;{@code dependencyGroupToRefresh}
 * &rarr; {@code dependency-group-to-refresh}). Unknown keys are ignored so that job
 * documents may carry settings this tool does not use; null values are not written.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE);
		return mapper;
	}

}
