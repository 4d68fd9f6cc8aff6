package io.github.tokenrate.internal;

import io.github.tokenrate.TokenBucket;
import org.testng.annotations.Test;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class ToStringBuilderTest
{
	@Test
	public void alignsPropertyNames()
	{
		String actual = new ToStringBuilder(ToStringBuilderTest.class).
			add("a", 1).
			add("longer", "value").
			toString();
		requireThat(actual, "actual").isEqualTo("""
			ToStringBuilderTest
			{
				a     : 1,
				longer: value
			}""");
	}

	@Test
	public void namesNestedClasses()
	{
		String actual = new ToStringBuilder(TokenBucket.Builder.class).add("rate", 1.0).toString();
		requireThat(actual, "actual").startsWith("TokenBucket.Builder\n");
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void blankName()
	{
		new ToStringBuilder(ToStringBuilderTest.class).add(" ", 1);
	}
}
