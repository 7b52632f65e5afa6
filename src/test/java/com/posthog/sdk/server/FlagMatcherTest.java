package com.posthog.sdk.server;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.JsonElement;
import com.posthog.sdk.server.DataModel.FeatureFlag;
import com.posthog.sdk.server.DataModel.Operator;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static com.posthog.sdk.server.ModelBuilders.attributes;
import static com.posthog.sdk.server.ModelBuilders.cohortCondition;
import static com.posthog.sdk.server.ModelBuilders.condition;
import static com.posthog.sdk.server.ModelBuilders.flagBuilder;
import static com.posthog.sdk.server.ModelBuilders.flagDependency;
import static com.posthog.sdk.server.ModelBuilders.groupBuilder;
import static com.posthog.sdk.server.ModelBuilders.variant;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.in;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class FlagMatcherTest extends BaseTest {
  private static final FlagValue TRUE = FlagValue.ofBoolean(true);
  private static final FlagValue FALSE = FlagValue.ofBoolean(false);

  private final Map<String, FeatureFlag> otherFlags = new HashMap<>();
  private final FlagMatcher matcher = new FlagMatcher(otherFlags::get, new ConditionEvaluator(), testLogger);

  @Test
  public void inactiveFlagIsFalseRegardlessOfRules() throws Exception {
    FeatureFlag f = flagBuilder("off-flag").active(false)
        .groups(groupBuilder().rollout(100).variant("a").build())
        .variants(variant("a", 100))
        .build();
    for (int i = 0; i < 50; i++) {
      assertEquals(FALSE, matcher.evaluate(f, "user-" + i, attributes()));
    }
  }

  @Test
  public void inactiveFlagIsFalseEvenIfConditionsWouldBeInconclusive() throws Exception {
    FeatureFlag f = flagBuilder("off-flag").active(false)
        .groups(groupBuilder().properties(condition("email", Operator.EXACT, "x")).build())
        .build();
    assertEquals(FALSE, matcher.evaluate(f, "user", attributes()));
  }

  @Test
  public void flagWithNoGroupsIsFalse() throws Exception {
    assertEquals(FALSE, matcher.evaluate(flagBuilder("no-groups").build(), "user", attributes()));
  }

  @Test
  public void groupWithoutConditionsAndFullRolloutMatchesEveryone() throws Exception {
    FeatureFlag f = flagBuilder("everyone").groups(groupBuilder().rollout(100).build()).build();
    for (int i = 0; i < 200; i++) {
      assertEquals(TRUE, matcher.evaluate(f, "user-" + i, attributes()));
    }
  }

  @Test
  public void groupWithoutRolloutMatchesEveryone() throws Exception {
    FeatureFlag f = flagBuilder("everyone").groups(groupBuilder().build()).build();
    assertEquals(TRUE, matcher.evaluate(f, "anyone", attributes()));
  }

  @Test
  public void zeroRolloutMatchesNobody() throws Exception {
    FeatureFlag f = flagBuilder("nobody").groups(groupBuilder().rollout(0).build()).build();
    for (int i = 0; i < 200; i++) {
      assertEquals(FALSE, matcher.evaluate(f, "user-" + i, attributes()));
    }
  }

  @Test
  public void partialRolloutUsesBucket() throws Exception {
    // "half-flag" buckets: user-0 is about 0.41, user-1 about 0.64
    FeatureFlag f = flagBuilder("half-flag").groups(groupBuilder().rollout(50).build()).build();
    assertEquals(TRUE, matcher.evaluate(f, "user-0", attributes()));
    assertEquals(FALSE, matcher.evaluate(f, "user-1", attributes()));
  }

  @Test
  public void betaFeaturesScenario() throws Exception {
    FeatureFlag f = flagBuilder("beta-features")
        .groups(groupBuilder().properties(condition("beta_user", Operator.EXACT, true)).rollout(100).build())
        .build();

    assertEquals(TRUE, matcher.evaluate(f, "user-1", attributes("beta_user", true)));
    assertEquals(FALSE, matcher.evaluate(f, "user-1", attributes("beta_user", false)));
    try {
      matcher.evaluate(f, "user-1", attributes());
      fail("expected InconclusiveMatchException");
    } catch (InconclusiveMatchException e) {
      assertThat(e.getMessage(), containsString("beta-features"));
    }
  }

  @Test
  public void homepageExperimentAssignmentsAreStable() throws Exception {
    FeatureFlag f = flagBuilder("homepage-experiment")
        .groups(groupBuilder().rollout(100).build())
        .variants(variant("control", 33), variant("variant-a", 33), variant("variant-b", 34))
        .build();

    String[] expected = {
      "variant-a", "variant-b", "control", "variant-a", "variant-a",
      "variant-a", "variant-b", "variant-a", "variant-b", "control",
      "variant-b", "variant-a", "variant-a", "variant-a", "variant-b",
      "control", "variant-a", "variant-a", "variant-a", "variant-b",
      "control", "variant-a", "variant-a", "variant-b", "variant-b",
      "variant-b", "control", "variant-b", "variant-b", "variant-b"
    };
    for (int i = 0; i < expected.length; i++) {
      assertEquals("user-" + i, FlagValue.ofVariant(expected[i]), matcher.evaluate(f, "user-" + i, attributes()));
    }
  }

  @Test
  public void everySubjectGetsExactlyOneVariantWhenPercentagesSumTo100() throws Exception {
    FeatureFlag f = flagBuilder("split")
        .groups(groupBuilder().build())
        .variants(variant("a", 33), variant("b", 33), variant("c", 34))
        .build();
    for (int i = 0; i < 500; i++) {
      FlagValue v = matcher.evaluate(f, "subject-" + i, attributes());
      assertEquals(FlagValue.Type.VARIANT, v.getType());
      assertThat(v.getVariant(), in(ImmutableSet.of("a", "b", "c")));
      assertEquals(v, matcher.evaluate(f, "subject-" + i, attributes()));
    }
  }

  @Test
  public void subjectOutsideAllVariantRangesGetsTrue() throws Exception {
    FeatureFlag f = flagBuilder("tiny")
        .groups(groupBuilder().build())
        .variants(variant("a", 0), variant("b", 0))
        .build();
    assertEquals(TRUE, matcher.evaluate(f, "user-1", attributes()));
  }

  @Test
  public void overrideGroupWinsOverEarlierGenericGroup() throws Exception {
    FeatureFlag f = flagBuilder("homepage-experiment")
        .groups(
            groupBuilder().rollout(100).build(),
            groupBuilder().properties(condition("plan", Operator.EXACT, "pro")).variant("control").build()
        )
        .variants(variant("control", 33), variant("variant-a", 33), variant("variant-b", 34))
        .build();

    // user-0 would naturally be assigned variant-a
    assertEquals(FlagValue.ofVariant("variant-a"), matcher.evaluate(f, "user-0", attributes("plan", "free")));
    assertEquals(FlagValue.ofVariant("control"), matcher.evaluate(f, "user-0", attributes("plan", "pro")));
  }

  @Test
  public void overrideNamingUnknownVariantFallsBackToAssignment() throws Exception {
    FeatureFlag f = flagBuilder("homepage-experiment")
        .groups(groupBuilder().variant("does-not-exist").build())
        .variants(variant("control", 33), variant("variant-a", 33), variant("variant-b", 34))
        .build();
    assertEquals(FlagValue.ofVariant("variant-a"), matcher.evaluate(f, "user-0", attributes()));
  }

  @Test
  public void overrideOnFlagWithoutVariantsGivesTrue() throws Exception {
    FeatureFlag f = flagBuilder("boolean-flag").groups(groupBuilder().variant("control").build()).build();
    assertEquals(TRUE, matcher.evaluate(f, "user-0", attributes()));
  }

  @Test
  public void laterGroupCanMatchAfterInconclusiveGroup() throws Exception {
    FeatureFlag f = flagBuilder("f")
        .groups(
            groupBuilder().properties(condition("email", Operator.EXACT, "a@b.com")).build(),
            groupBuilder().properties(condition("country", Operator.EXACT, "US")).build()
        )
        .build();
    assertEquals(TRUE, matcher.evaluate(f, "user", attributes("country", "us")));
  }

  @Test
  public void inconclusiveGroupWithNoMatchIsInconclusive() {
    FeatureFlag f = flagBuilder("f")
        .groups(
            groupBuilder().properties(condition("email", Operator.EXACT, "a@b.com")).build(),
            groupBuilder().properties(condition("country", Operator.EXACT, "US")).build()
        )
        .build();
    try {
      matcher.evaluate(f, "user", attributes("country", "GB"));
      fail("expected InconclusiveMatchException");
    } catch (InconclusiveMatchException e) {
      assertThat(e.getMessage(), containsString("email"));
    }
  }

  @Test
  public void falseConditionBeforeMissingOneMakesGroupFalse() throws Exception {
    FeatureFlag f = flagBuilder("f")
        .groups(groupBuilder().properties(
            condition("country", Operator.EXACT, "US"),
            condition("email", Operator.EXACT, "a@b.com")
        ).build())
        .build();
    assertEquals(FALSE, matcher.evaluate(f, "user", attributes("country", "GB")));
  }

  @Test
  public void rolloutIsOnlyCheckedWhenConditionsMatch() throws Exception {
    FeatureFlag f = flagBuilder("nobody")
        .groups(groupBuilder().properties(condition("email", Operator.IS_NOT_SET, true)).rollout(0).build())
        .build();
    assertEquals(FALSE, matcher.evaluate(f, "user", attributes()));
  }

  @Test
  public void cohortConditionIsInconclusive() {
    FeatureFlag f = flagBuilder("cohort-flag").groups(groupBuilder().properties(cohortCondition("42")).build())
        .build();
    try {
      matcher.evaluate(f, "user", attributes("id", "42"));
      fail("expected InconclusiveMatchException");
    } catch (InconclusiveMatchException e) {
      assertThat(e.getMessage(), containsString("Cohort"));
    }
  }

  @Test
  public void flagDependencyOnEnabledFlag() throws Exception {
    otherFlags.put("base", flagBuilder("base").groups(groupBuilder().rollout(100).build()).build());

    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.EXACT, true), "user", attributes()));
    assertEquals(FALSE, matcher.evaluate(dependentFlag(Operator.EXACT, false), "user", attributes()));
    assertEquals(FALSE, matcher.evaluate(dependentFlag(Operator.IS_NOT, true), "user", attributes()));
    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.EXACT, "true"), "user", attributes()));
    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.EXACT, ""), "user", attributes()));
  }

  @Test
  public void flagDependencyOnDisabledFlag() throws Exception {
    otherFlags.put("base", flagBuilder("base").active(false).build());

    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.EXACT, false), "user", attributes()));
    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.EXACT, "false"), "user", attributes()));
    assertEquals(FALSE, matcher.evaluate(dependentFlag(Operator.EXACT, true), "user", attributes()));
  }

  @Test
  public void flagDependencyOnVariant() throws Exception {
    otherFlags.put("base", flagBuilder("base")
        .groups(groupBuilder().variant("test").build())
        .variants(variant("control", 50), variant("test", 50))
        .build());

    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.EXACT, "TEST"), "user", attributes()));
    assertEquals(FALSE, matcher.evaluate(dependentFlag(Operator.EXACT, "control"), "user", attributes()));
    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.EXACT, true), "user", attributes()));
    assertEquals(FALSE, matcher.evaluate(dependentFlag(Operator.EXACT, false), "user", attributes()));
    assertEquals(TRUE, matcher.evaluate(dependentFlag(Operator.IS_NOT, "control"), "user", attributes()));
  }

  @Test
  public void flagDependencyIsEvaluatedWithoutSubjectAttributes() {
    otherFlags.put("base", flagBuilder("base")
        .groups(groupBuilder().properties(condition("plan", Operator.EXACT, "pro")).build())
        .build());
    try {
      matcher.evaluate(dependentFlag(Operator.EXACT, true), "user", attributes("plan", "pro"));
      fail("expected InconclusiveMatchException");
    } catch (InconclusiveMatchException e) {
      assertThat(e.getMessage(), containsString("dependent-flag"));
    }
  }

  @Test
  public void flagDependencyOnMissingFlagIsInconclusive() {
    try {
      matcher.evaluate(dependentFlag(Operator.EXACT, true), "user", attributes());
      fail("expected InconclusiveMatchException");
    } catch (InconclusiveMatchException e) {
      assertThat(e.getMessage(), containsString("base"));
    }
  }

  @Test
  public void flagDependencyWithUnsupportedOperatorIsInconclusive() {
    otherFlags.put("base", flagBuilder("base").groups(groupBuilder().build()).build());
    try {
      matcher.evaluate(dependentFlag(Operator.ICONTAINS, "t"), "user", attributes());
      fail("expected InconclusiveMatchException");
    } catch (InconclusiveMatchException e) {
      assertThat(e.getMessage(), containsString("icontains"));
    }
  }

  @Test
  public void resultsAreTheSameWithoutPreprocessing() throws Exception {
    ModelBuilders.FlagBuilder builder = flagBuilder("homepage-experiment")
        .groups(
            groupBuilder().properties(condition("email", Operator.REGEX, "@example\\.com$")).rollout(100).build(),
            groupBuilder().properties(condition("plan", Operator.EXACT, "pro")).variant("variant-b").build()
        )
        .variants(variant("control", 33), variant("variant-a", 33), variant("variant-b", 34));
    FeatureFlag preprocessed = builder.build();
    FeatureFlag raw = builder.disablePreprocessing(true).build();

    Map<String, Map<String, JsonElement>> subjects = ImmutableMap.of(
        "user-0", attributes("email", "a@example.com", "plan", "free"),
        "user-1", attributes("email", "a@other.com", "plan", "pro"),
        "user-2", attributes("email", "b@example.com", "plan", "pro"),
        "user-3", attributes("email", "c@other.com", "plan", "free")
        );
    for (Map.Entry<String, Map<String, JsonElement>> e: subjects.entrySet()) {
      assertEquals(matcher.evaluate(preprocessed, e.getKey(), e.getValue()),
          matcher.evaluate(raw, e.getKey(), e.getValue()));
    }
    assertEquals(FlagValue.ofVariant("variant-b"), matcher.evaluate(raw, "user-1", subjects.get("user-1")));
  }

  private static FeatureFlag dependentFlag(Operator op, Object expected) {
    return flagBuilder("dependent-flag")
        .groups(groupBuilder().properties(flagDependency("base", op, expected)).build())
        .build();
  }
}
