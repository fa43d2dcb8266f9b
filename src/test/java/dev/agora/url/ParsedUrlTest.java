package dev.agora.url;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ParsedUrlTest {

  @Test
  void splits_all_components() {
    ParsedUrl url = ParsedUrl.parse("https://user@www.example.com:8443/a/b?q=1&r=2#frag");

    assertThat(url.scheme()).isEqualTo("https");
    assertThat(url.host()).isEqualTo("user@www.example.com:8443");
    assertThat(url.path()).isEqualTo("/a/b");
    assertThat(url.query()).isEqualTo("q=1&r=2");
    assertThat(url.fragment()).isEqualTo("frag");
    assertThat(url.url()).isEqualTo("https://user@www.example.com:8443/a/b?q=1&r=2#frag");
  }

  @Test
  void missing_components_are_empty() {
    ParsedUrl url = ParsedUrl.parse("http://example.com");

    assertThat(url.path()).isEmpty();
    assertThat(url.query()).isEmpty();
    assertThat(url.fragment()).isEmpty();
  }

  @Test
  void never_fails_on_garbage() {
    ParsedUrl url = ParsedUrl.parse("not a url at all");

    assertThat(url.scheme()).isEmpty();
    assertThat(url.host()).isEmpty();
    assertThat(url.path()).isEqualTo("not a url at all");
  }

  @Test
  void protocol_relative_url_has_host_but_no_scheme() {
    ParsedUrl url = ParsedUrl.parse("//cdn.example.com/img.png");

    assertThat(url.scheme()).isEmpty();
    assertThat(url.host()).isEqualTo("cdn.example.com");
    assertThat(url.path()).isEqualTo("/img.png");
  }

  @Test
  void only_https_is_secure() {
    assertThat(ParsedUrl.parse("https://x.com").isSecure()).isTrue();
    assertThat(ParsedUrl.parse("HTTPS://x.com").isSecure()).isTrue();
    assertThat(ParsedUrl.parse("http://x.com").isSecure()).isFalse();
    assertThat(ParsedUrl.parse("ftp://x.com").isSecure()).isFalse();
  }

  @Test
  void parameters_of_the_last_segment_are_split_off() {
    ParsedUrl url = ParsedUrl.parse("https://x.com/a;v=1/b;jsessionid=42?q=1");

    assertThat(url.path()).isEqualTo("/a;v=1/b");
    assertThat(url.params()).isEqualTo("jsessionid=42");
    assertThat(url.query()).isEqualTo("q=1");
  }

  @Test
  void path_without_parameters_has_empty_params() {
    assertThat(ParsedUrl.parse("https://x.com/a;v=1/b").params()).isEmpty();
  }
}
