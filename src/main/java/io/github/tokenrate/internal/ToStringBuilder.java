package io.github.tokenrate.internal;

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.StringJoiner;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Formats the {@code toString()} output of the library's types as an aligned, multi-line list of
 * properties.
 */
public final class ToStringBuilder
{
	private final Class<?> aClass;
	private final List<Entry<String, String>> properties = new ArrayList<>();

	/**
	 * Creates a new builder.
	 *
	 * @param aClass the type of object being rendered
	 * @throws NullPointerException if {@code aClass} is null
	 */
	public ToStringBuilder(Class<?> aClass)
	{
		requireThat(aClass, "aClass").isNotNull();
		this.aClass = aClass;
	}

	/**
	 * Adds a property.
	 *
	 * @param name  the name of the property
	 * @param value the value of the property
	 * @return this
	 * @throws NullPointerException     if {@code name} is null
	 * @throws IllegalArgumentException if {@code name} is blank
	 */
	public ToStringBuilder add(String name, Object value)
	{
		requireThat(name, "name").isNotBlank();
		properties.add(new SimpleImmutableEntry<>(name, String.valueOf(value)));
		return this;
	}

	/**
	 * @param text      the {@code String} to align
	 * @param minLength the minimum length of the result
	 * @return {@code text} padded on the right with spaces
	 */
	private static String alignLeft(String text, int minLength)
	{
		int actualLength = text.length();
		if (actualLength >= minLength)
			return text;
		return text + " ".repeat(minLength - actualLength);
	}

	/**
	 * Returns the name of the class, prefixed by the names of its enclosing classes.
	 *
	 * @return the qualified simple name (e.g. {@code TokenBucket.Builder})
	 */
	private String getName()
	{
		StringBuilder name = new StringBuilder(aClass.getSimpleName());
		for (Class<?> enclosing = aClass.getEnclosingClass(); enclosing != null;
		     enclosing = enclosing.getEnclosingClass())
		{
			name.insert(0, enclosing.getSimpleName() + ".");
		}
		return name.toString();
	}

	@Override
	public String toString()
	{
		int maxKeyLength = 0;
		for (Entry<String, String> entry : properties)
			maxKeyLength = Math.max(maxKeyLength, entry.getKey().length());

		StringJoiner output = new StringJoiner(",\n");
		for (Entry<String, String> entry : properties)
			output.add(alignLeft(entry.getKey(), maxKeyLength) + ": " + entry.getValue());
		return getName() + "\n" +
			"{\n" +
			"\t" + output.toString().replaceAll("\n", "\n\t") + "\n" +
			"}";
	}
}
