package io.evitadb.compendium.check;

import io.evitadb.compendium.identity.FileIdentity;
import io.evitadb.compendium.identity.FileIdentityResolver;
import io.evitadb.compendium.identity.IdentityResolutionException;
import io.evitadb.compendium.model.MarkdownSource;
import io.evitadb.compendium.model.MergeOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("LinkValidator classifies section links against the registry")
public class LinkValidatorTest {

	private static final Path A = Path.of("/docs/a.md");
	private static final Path B = Path.of("/docs/b.md");
	private static final Path OUTSIDE = Path.of("/docs/outside.md");
	private static final Map<Path, FileIdentity> IDENTITIES = Map.of(
		A, new FileIdentity("n1"),
		B, new FileIdentity("n2"),
		OUTSIDE, new FileIdentity("n3")
	);

	private FileIdentityResolver resolver;
	private MarkdownSource a;

	@BeforeEach
	void setUp() {
		this.resolver = mock(FileIdentityResolver.class);
		when(this.resolver.identity(any(Path.class))).thenAnswer(invocation -> {
			final Path path = invocation.getArgument(0);
			final FileIdentity identity = IDENTITIES.get(path);
			if (identity == null) {
				throw IdentityResolutionException.missingFile(path, null);
			}
			return identity;
		});
		this.a = new MarkdownSource(A, "# Title\n## Some Section\n## Intro\ntext\n## Intro\n");
	}

	@Nonnull
	private List<LinkError> validate(String bContent, MergeOptions options) {
		final MarkdownSource b = new MarkdownSource(B, bContent);
		final LabelRegistry registry = LabelRegistry.build(List.of(this.a, b), this.resolver, options.skipCodeBlocks());
		return new LinkValidator(registry, this.resolver, options).validate(b);
	}

	@Test
	@DisplayName("accepts a link to an existing unique label")
	public void shouldAcceptValidLink() {
		assertTrue(validate("[x](./a.md#some-section)\n", MergeOptions.defaults()).isEmpty());
	}

	@Test
	@DisplayName("reports a direct link without consulting the registry")
	public void shouldReportDirectLink() {
		final List<LinkError> errors = validate("[x](./a.md)\n", MergeOptions.defaults());

		assertEquals(1, errors.size());
		assertEquals(LinkError.LinkErrorType.DIRECT_LINK, errors.get(0).type());
		assertEquals(A, errors.get(0).targetFile());
		assertNull(errors.get(0).label());
	}

	@Test
	@DisplayName("reports a dead file link for a path that does not exist")
	public void shouldReportDeadFileForMissingPath() {
		final List<LinkError> errors = validate("[x](./missing.md#missing)\n", MergeOptions.defaults());

		assertEquals(1, errors.size());
		assertEquals(LinkError.LinkErrorType.DEAD_FILE_LINK, errors.get(0).type());
		assertEquals(Path.of("/docs/missing.md"), errors.get(0).targetFile());
	}

	@Test
	@DisplayName("reports a dead file link for an existing file outside the document")
	public void shouldReportDeadFileForUnknownFile() {
		final List<LinkError> errors = validate("[x](./outside.md#some-section)\n", MergeOptions.defaults());

		assertEquals(LinkError.LinkErrorType.DEAD_FILE_LINK, errors.get(0).type());
	}

	@Test
	@DisplayName("reports a dead label link for a label the target does not define")
	public void shouldReportDeadLabel() {
		final List<LinkError> errors = validate("[x](./a.md#missing)\n", MergeOptions.defaults());

		assertEquals(1, errors.size());
		assertEquals(LinkError.LinkErrorType.DEAD_LABEL_LINK, errors.get(0).type());
		assertEquals("missing", errors.get(0).label());
	}

	@Test
	@DisplayName("reports a clash for a label defined twice even though it exists")
	public void shouldReportClash() {
		final List<LinkError> errors = validate("[x](./a.md#intro)\n", MergeOptions.defaults());

		assertEquals(1, errors.size());
		assertEquals(LinkError.LinkErrorType.LABEL_CLASH, errors.get(0).type());
	}

	@Test
	@DisplayName("resolves paths relative to the source file, not the working directory")
	public void shouldResolveRelativeToSource() {
		final List<LinkError> errors = validate("[x](./../docs/a.md#title)\n", MergeOptions.defaults());

		assertTrue(errors.isEmpty());
	}

	@Test
	@DisplayName("validates local links when enabled")
	public void shouldValidateLocalLinks() {
		final String content = "# Local\n[ok](#local) [bad](#nowhere)\n";

		final List<LinkError> errors = validate(content, MergeOptions.defaults());
		assertEquals(1, errors.size());
		assertEquals(LinkError.LinkErrorType.DEAD_LABEL_LINK, errors.get(0).type());
		assertEquals(B, errors.get(0).targetFile());

		assertTrue(validate(content, new MergeOptions("\\newpage", false, false)).isEmpty());
	}

	@Test
	@DisplayName("groups errors by source file and omits clean files")
	public void shouldGroupErrorsBySourceFile() {
		final MarkdownSource b = new MarkdownSource(B, "[x](./a.md#missing)\n[y](./a.md)\n");
		final LabelRegistry registry = LabelRegistry.build(List.of(this.a, b), this.resolver, false);

		final ValidationReport report = new LinkValidator(registry, this.resolver, MergeOptions.defaults())
			.validateAll(List.of(this.a, b));

		assertEquals(List.of(B), List.copyOf(report.errors().keySet()));
		assertEquals(2, report.errorCount());
		assertTrue(report.errorsOf(A).isEmpty());
	}

	@Test
	@DisplayName("never asks for the identity of a direct link target")
	public void shouldNotResolveDirectLinkTarget() {
		validate("[x](./elsewhere.md)\n", MergeOptions.defaults());

		verify(this.resolver, never()).identity(Path.of("/docs/elsewhere.md"));
	}
}
