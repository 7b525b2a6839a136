package org.javai.nlrecon.kg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives a business alias from a physical table name by dropping layer prefixes,
 * e.g. {@code brz_lnd_RBP_GPU} becomes {@code rbp_gpu}.
 */
public final class AliasDeriver {

	public static final Set<String> DEFAULT_NOISE_PREFIXES = Set.of("brz", "lnd", "slv", "gld", "stg", "raw", "tbl");

	private final Set<String> noisePrefixes;

	public AliasDeriver() {
		this(DEFAULT_NOISE_PREFIXES);
	}

	public AliasDeriver(Set<String> noisePrefixes) {
		this.noisePrefixes = noisePrefixes.stream()
				.map(prefix -> prefix.toLowerCase(Locale.ROOT))
				.collect(Collectors.toUnmodifiableSet());
	}

	public Optional<String> derive(String tableName) {
		if (tableName == null || tableName.isBlank()) {
			return Optional.empty();
		}
		List<String> parts = new ArrayList<>(Arrays.asList(tableName.toLowerCase(Locale.ROOT).split("_+")));
		parts.removeIf(String::isEmpty);
		while (!parts.isEmpty() && noisePrefixes.contains(parts.get(0))) {
			parts.remove(0);
		}
		if (parts.isEmpty()) {
			return Optional.empty();
		}
		String alias = String.join("_", parts);
		if (alias.equalsIgnoreCase(tableName)) {
			return Optional.empty();
		}
		return Optional.of(alias);
	}
}
