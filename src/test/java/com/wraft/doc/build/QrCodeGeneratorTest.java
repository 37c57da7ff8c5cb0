package com.wraft.doc.build;

import com.google.zxing.BinaryBitmap;
import com.google.zxing.MultiFormatReader;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.wraft.doc.exception.BuildWorkspaceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("QR code generation")
class QrCodeGeneratorTest {

    @TempDir
    Path contentsRoot;

    private final QrCodeGenerator generator = new QrCodeGenerator();

    @Test
    @DisplayName("Should write a PNG that decodes back to the instance uuid")
    void generate_shouldEncodeUuid() throws Exception {
        // Given
        BuildWorkspace workspace = BuildWorkspace.of(contentsRoot, "OFF0001");
        Files.createDirectories(workspace.root());
        String uuid = UUID.randomUUID().toString();

        // When
        Path qr = generator.generate(uuid, workspace);

        // Then
        assertThat(qr).isEqualTo(workspace.qrFile());
        BufferedImage image = ImageIO.read(qr.toFile());
        assertThat(image.getWidth()).isEqualTo(QrCodeGenerator.SIZE_PX);

        Result decoded = new MultiFormatReader().decode(
                new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image))));
        assertThat(decoded.getText()).isEqualTo(uuid);
    }

    @Test
    @DisplayName("Should fail with the target path when the workspace is missing")
    void generate_withoutWorkspace_shouldFail() {
        BuildWorkspace workspace = BuildWorkspace.of(contentsRoot, "MISSING");

        BuildWorkspaceException ex = assertThrows(BuildWorkspaceException.class,
                () -> generator.generate("uuid", workspace));

        assertThat(ex.getPath()).isEqualTo(workspace.qrFile());
    }
}
