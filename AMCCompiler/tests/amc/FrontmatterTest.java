package amc;

import static com.google.common.truth.Truth.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class FrontmatterTest {

  @Test
  public void render() {
    String yaml =
        new Frontmatter()
            .put("name", "review")
            .put("model", Optional.empty())
            .put("argument-hint", Optional.of("[file]"))
            .putBoolean("user-invocable", Optional.of(false))
            .putBoolean("disable-model-invocation", Optional.empty())
            .putList("allowed-tools", ImmutableList.of("Read", "Bash(git:*)"))
            .putList("skills", ImmutableList.of())
            .render();

    assertThat(yaml)
        .isEqualTo(
            "---\n"
                + "name: review\n"
                + "argument-hint: '[file]'\n"
                + "user-invocable: false\n"
                + "allowed-tools:\n"
                + "  - Read\n"
                + "  - Bash(git:*)\n"
                + "---");
  }

  @Test
  public void plainScalars() {
    assertThat(Frontmatter.scalar("hello world")).isEqualTo("hello world");
    assertThat(Frontmatter.scalar("it's fine")).isEqualTo("it's fine");
    assertThat(Frontmatter.scalar("Read, Write")).isEqualTo("Read, Write");
    assertThat(Frontmatter.scalar("v1.2")).isEqualTo("v1.2");
  }

  @Test
  public void quotedScalars() {
    assertThat(Frontmatter.scalar("")).isEqualTo("''");
    assertThat(Frontmatter.scalar("yes")).isEqualTo("'yes'");
    assertThat(Frontmatter.scalar("Null")).isEqualTo("'Null'");
    assertThat(Frontmatter.scalar("42")).isEqualTo("'42'");
    assertThat(Frontmatter.scalar("-1.5e3")).isEqualTo("'-1.5e3'");
    assertThat(Frontmatter.scalar("key: value")).isEqualTo("'key: value'");
    assertThat(Frontmatter.scalar("ends with:")).isEqualTo("'ends with:'");
    assertThat(Frontmatter.scalar("a #comment")).isEqualTo("'a #comment'");
    assertThat(Frontmatter.scalar("#tag")).isEqualTo("'#tag'");
    assertThat(Frontmatter.scalar("'quoted'")).isEqualTo("'''quoted'''");
    assertThat(Frontmatter.scalar(" padded")).isEqualTo("' padded'");
  }

  @Test
  public void controlCharactersUseDoubleQuotes() {
    assertThat(Frontmatter.scalar("line\nbreak \"x\" \\"))
        .isEqualTo("\"line\\nbreak \\\"x\\\" \\\\\"");
  }
}
