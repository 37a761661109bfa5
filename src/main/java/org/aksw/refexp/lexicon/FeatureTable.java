package org.aksw.refexp.lexicon;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.apache.log4j.Logger;

import com.google.common.io.Resources;

/**
 * Canonical names of feature keys and values, read once from the class path file
 * <code>features.properties</code>. Entries <code>key.&lt;synonym&gt;</code> map a key
 * synonym to the canonical key, entries <code>&lt;KEY&gt;.&lt;synonym&gt;</code> map a
 * value synonym of that key to the canonical value. Synonyms are matched case
 * insensitively, unknown keys and values are kept as they are.
 */
public final class FeatureTable {

	private static final Logger logger = Logger.getLogger(FeatureTable.class.getName());

	public static final String RESOURCE = "features.properties";

	private static final String KEY_PREFIX = "key.";

	private final Map<String, String> keys = new HashMap<>();
	private final Map<String, String> values = new HashMap<>();

	private static class DefaultHolder {
		static final FeatureTable INSTANCE = load(RESOURCE);
	}

	private FeatureTable(Properties properties) {
		for (String name : properties.stringPropertyNames()) {
			String value = properties.getProperty(name).trim();
			if (name.startsWith(KEY_PREFIX)) {
				keys.put(lower(name.substring(KEY_PREFIX.length())), value);
			} else {
				int dot = name.indexOf('.');
				if (dot > 0) {
					values.put(name.substring(0, dot) + "." + lower(name.substring(dot + 1)), value);
				}
			}
		}
	}

	/**
	 * @return the table read from the class path, loaded on first use
	 */
	public static FeatureTable getDefault() {
		return DefaultHolder.INSTANCE;
	}

	public static FeatureTable load(String resource) {
		URL url = FeatureTable.class.getClassLoader().getResource(resource);
		if (url == null) {
			throw new IllegalStateException("Missing class path resource " + resource);
		}
		Properties properties = new Properties();
		try (InputStream in = Resources.asByteSource(url).openStream()) {
			properties.load(in);
		} catch (IOException e) {
			throw new IllegalStateException("Could not read " + resource, e);
		}
		logger.debug("Loaded " + properties.size() + " feature names from " + url);
		return new FeatureTable(properties);
	}

	public String canonicalKey(String key) {
		String canonical = keys.get(lower(key));
		return canonical != null ? canonical : key;
	}

	public String canonicalValue(String key, String value) {
		String canonical = values.get(canonicalKey(key) + "." + lower(value));
		return canonical != null ? canonical : value;
	}

	/**
	 * @return a copy of the features with canonical keys and values
	 */
	public Map<String, String> normalise(Map<String, String> features) {
		Map<String, String> normalised = new LinkedHashMap<>();
		for (Map.Entry<String, String> feature : features.entrySet()) {
			String key = canonicalKey(feature.getKey());
			normalised.put(key, canonicalValue(key, feature.getValue()));
		}
		return normalised;
	}

	private static String lower(String s) {
		return s.trim().toLowerCase(Locale.ENGLISH);
	}
}
