package org.javai.pda.definition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.InputStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.jar.JarEntry;
import java.util.jar.JarOutputStream;
import org.apache.logging.log4j.Level;
import org.javai.pda.PushdownAutomaton;
import org.javai.pda.testsupport.LogCaptorAppender;
import org.javai.pda.testsupport.SampleDefinitions;
import org.javai.pda.validation.ValidationMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PdaDefinitionRegistryTest {

	@Mock
	private PdaDefinitionParser parser;

	@Test
	void shouldLoadDefinitionFromResource() {
		PdaDefinitionRegistry registry = PdaDefinitionRegistry.create();
		PdaDescriptor descriptor = registry.registerResource("pda/anbn.yml", getClass().getClassLoader());

		assertThat(descriptor.id()).isEqualTo("anbn");
		assertThat(registry.descriptorFor("anbn")).contains(descriptor);
		assertThat(registry.requireAutomaton("anbn").accepts("aabb")).isTrue();
	}

	@Test
	void shouldDeduplicateById() {
		PdaDefinitionRegistry registry = PdaDefinitionRegistry.create();
		try (LogCaptorAppender captor = LogCaptorAppender.capture(PdaDefinitionRegistry.class, Level.DEBUG)) {
			PdaDescriptor first = registry.registerResource("pda/anbn.yml", getClass().getClassLoader());
			PdaDescriptor second = registry.registerResource("pda/anbn.yml", getClass().getClassLoader());

			assertThat(second).isSameAs(first);
			assertThat(registry.descriptors()).hasSize(1);
			assertThat(captor.messages()).anyMatch(message -> message.contains("'anbn' already registered"));
		}
	}

	@Test
	void shouldRegisterFromPath() throws Exception {
		PdaDefinitionRegistry registry = PdaDefinitionRegistry.create();
		URL resource = Objects.requireNonNull(getClass().getClassLoader().getResource("pda/even-palindromes.json"));

		PdaDescriptor descriptor = registry.registerPath(Path.of(resource.toURI()));

		assertThat(descriptor.id()).isEqualTo("even-palindromes");
		assertThat(registry.requireAutomaton("even-palindromes").accepts("baab")).isTrue();
	}

	@Test
	void shouldDiscoverMetaInfDefinitions() {
		PdaDefinitionRegistry registry = PdaDefinitionRegistry.create()
				.registerMetaInfDefinitions(getClass().getClassLoader());

		PushdownAutomaton pda = registry.requireAutomaton("balanced-parens");

		assertThat(pda.accepts("(())")).isTrue();
		assertThat(pda.accepts(")(")).isFalse();
	}

	@Test
	void shouldDiscoverDefinitionsPackagedInJar(@TempDir Path dir) throws Exception {
		Path jar = dir.resolve("definitions.jar");
		try (JarOutputStream out = new JarOutputStream(Files.newOutputStream(jar))) {
			out.putNextEntry(new JarEntry("META-INF/"));
			out.closeEntry();
			writeEntry(out, "META-INF/pda-single-a.yml", """
					pda:
					  id: single-a
					  mode: strict
					states: [s, t]
					input_symbols: [a]
					stack_symbols: [Z]
					initial_state: s
					initial_stack_symbol: Z
					final_states: [t]
					transitions:
					  s:
					    a: { Z: [t, [Z]] }
					""");
			writeEntry(out, "META-INF/pda-broken.yml", "transitions: [not, a, mapping]\n");
			writeEntry(out, "META-INF/other.yml", "pda: { id: ignored }\n");
		}

		PdaDefinitionRegistry registry;
		try (URLClassLoader loader = new URLClassLoader(new URL[] { jar.toUri().toURL() }, null);
				LogCaptorAppender captor = LogCaptorAppender.capture(PdaDefinitionRegistry.class, Level.WARN)) {
			registry = PdaDefinitionRegistry.create().registerMetaInfDefinitions(loader);

			assertThat(captor.messagesAt(Level.WARN)).anyMatch(message -> message.contains("pda-broken.yml"));
		}

		assertThat(registry.descriptors()).extracting(PdaDescriptor::id).containsExactly("single-a");
		assertThat(registry.requireAutomaton("single-a").accepts("a")).isTrue();
	}

	private static void writeEntry(JarOutputStream out, String name, String content) throws Exception {
		out.putNextEntry(new JarEntry(name));
		out.write(content.getBytes(StandardCharsets.UTF_8));
		out.closeEntry();
	}

	@Test
	void shouldFailWhenResourceIsMissing() {
		PdaDefinitionRegistry registry = PdaDefinitionRegistry.create();

		assertThatThrownBy(() -> registry.registerResource("does-not-exist.yml", getClass().getClassLoader()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void shouldFailForUnknownId() {
		assertThatThrownBy(() -> PdaDefinitionRegistry.create().requireAutomaton("nope"))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("nope");
	}

	@Test
	void shouldRejectDescriptorWithoutId() {
		PdaDescriptor anonymous = new PdaDescriptor(null, null, ValidationMode.LENIENT, SampleDefinitions.anbn());

		assertThatThrownBy(() -> PdaDefinitionRegistry.create().register(anonymous))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void shouldDelegateParsingToParser() {
		PdaDescriptor stubbed = new PdaDescriptor("stubbed", "from a mock", ValidationMode.STRICT,
				SampleDefinitions.ancbn());
		when(parser.parse(any(InputStream.class))).thenReturn(stubbed);
		PdaDefinitionRegistry registry = PdaDefinitionRegistry.create(parser);

		PdaDescriptor descriptor = registry.registerResource("pda/anbn.yml", getClass().getClassLoader());

		assertThat(descriptor).isSameAs(stubbed);
		assertThat(registry.requireAutomaton("stubbed").isDeterministic()).isTrue();
		verify(parser, times(1)).parse(any(InputStream.class));
	}

	@Test
	void shouldWrapParseFailures() {
		when(parser.parse(any(InputStream.class))).thenThrow(new DefinitionParseException("broken"));
		PdaDefinitionRegistry registry = PdaDefinitionRegistry.create(parser);

		assertThatThrownBy(() -> registry.registerResource("pda/anbn.yml", getClass().getClassLoader()))
				.isInstanceOf(IllegalStateException.class)
				.hasCauseInstanceOf(DefinitionParseException.class);
	}
}
