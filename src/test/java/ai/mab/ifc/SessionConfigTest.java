package ai.mab.ifc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.yaml.snakeyaml.error.YAMLException;

import ai.mab.InvalidParameterException;
import lombok.val;

public class SessionConfigTest {
  private static SessionConfig parse(final String yaml) {
    return SessionConfig.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  public void testDefaults() {
    val config = new SessionConfig();
    assertThat(config.articles).isEqualTo(10);
    assertThat(config.seed).isEqualTo(42L);
    assertThat(config.rounds).isEqualTo(1000);
    assertThat(config.trials).isEqualTo(5);
    assertThat(config.contextual).isFalse();
    assertThat(config.policies).containsExactly(SessionConfig.EPSILON_GREEDY, SessionConfig.UCB,
        SessionConfig.THOMPSON);
  }

  @Test
  public void testEmptyDocument() {
    val config = parse("");
    assertThat(config.toString()).isEqualTo(new SessionConfig().toString());
  }

  @Test
  public void testBundledSessionMatchesDefaults() throws IOException {
    try (InputStream in = SessionConfig.class.getResourceAsStream("/session.yaml")) {
      val config = SessionConfig.load(in);
      val defaults = new SessionConfig();
      assertThat(config.toString()).isEqualTo(defaults.toString());
      assertThat(config.epsilon).isEqualTo(defaults.epsilon);
      assertThat(config.c).isEqualTo(defaults.c);
      assertThat(config.alphaPrior).isEqualTo(defaults.alphaPrior);
      assertThat(config.betaPrior).isEqualTo(defaults.betaPrior);
      assertThat(config.linUcbAlpha).isEqualTo(defaults.linUcbAlpha);
      assertThat(config.linUcbRegularization).isEqualTo(defaults.linUcbRegularization);
    }
  }

  @Test
  public void testLoadFile() throws Exception {
    val config = SessionConfig.load(Path.of(SessionConfigTest.class.getResource("/contextual-session.yaml").toURI()));
    assertThat(config.articles).isEqualTo(6);
    assertThat(config.seed).isEqualTo(7L);
    assertThat(config.rounds).isEqualTo(200);
    assertThat(config.trials).isEqualTo(2);
    assertThat(config.contextual).isTrue();
    assertThat(config.epsilon).isEqualTo(.2);
    assertThat(config.c).isEqualTo(2);
    assertThat(config.linUcbAlpha).isEqualTo(.5);
    assertThat(config.linUcbRegularization).isEqualTo(2);
    assertThat(config.policies).containsExactly(SessionConfig.EPSILON_GREEDY, SessionConfig.LINUCB);
  }

  @Test
  public void testMissingFile() {
    assertThatThrownBy(() -> SessionConfig.load(Path.of("does-not-exist.yaml"))).isInstanceOf(IOException.class);
  }

  @Test
  public void testNullSeed() {
    assertThat(parse("seed: null").seed).isNull();
    assertThat(parse("seed: 3").seed).isEqualTo(3L);
  }

  @Test
  public void testUnknownPolicy() {
    assertThatThrownBy(() -> parse("policies: [softmax]")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("softmax");
  }

  @Test
  public void testInvalidCounts() {
    assertThatThrownBy(() -> parse("rounds: 0")).isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parse("trials: -1")).isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parse("articles: 0")).isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parse("policies: []")).isInstanceOf(InvalidParameterException.class);
  }

  @Test
  public void testDuplicateKey() {
    assertThatThrownBy(() -> parse("rounds: 10\nrounds: 20\n")).isInstanceOf(YAMLException.class);
  }

  @Test
  public void testWrongTypes() {
    assertThatThrownBy(() -> parse("rounds: ten")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("rounds");
    assertThatThrownBy(() -> parse("contextual: 1")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("contextual");
    assertThatThrownBy(() -> parse("policies: 3")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("policies");
    assertThatThrownBy(() -> parse("policies: [ucb, 3]")).isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parse("epsilon: high")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("epsilon");
    assertThatThrownBy(() -> parse("seed: abc")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("seed");
    assertThatThrownBy(() -> parse("linucb: 5")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("linucb");
    assertThatThrownBy(() -> parse("linucb:\n  alpha: wide\n")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("alpha");
  }

  @Test
  public void testNonIntegralCount() {
    assertThatThrownBy(() -> parse("rounds: 1.9")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("rounds");
    assertThatThrownBy(() -> parse("trials: 3000000000")).isInstanceOf(InvalidParameterException.class)
        .hasMessageContaining("trials");
  }

  @Test
  public void testIntegralDoubles() {
    val config = parse("c: 3\nepsilon: 0\n");
    assertThat(config.c).isEqualTo(3);
    assertThat(config.epsilon).isEqualTo(0);
  }

  @Test
  public void testNotAMapping() {
    assertThatThrownBy(() -> parse("- rounds\n- trials\n")).isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parse("just a string")).isInstanceOf(InvalidParameterException.class);
  }
}
