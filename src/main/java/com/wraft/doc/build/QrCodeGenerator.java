package com.wraft.doc.build;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.wraft.doc.exception.BuildWorkspaceException;
import com.wraft.doc.model.CallContext;
import com.wraft.doc.model.ServiceType;
import com.wraft.doc.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes {@code qr.png} encoding the instance uuid into the workspace.
 */
@Slf4j
@Component
public class QrCodeGenerator {

    static final int SIZE_PX = 256;

    private final QRCodeWriter writer = new QRCodeWriter();

    /**
     * @return path of the written image, as it is embedded in the header
     */
    public Path generate(String instanceUuid, BuildWorkspace workspace) {
        Path destination = workspace.qrFile();
        CallContext call = ExternalCallLogger.startCall(ServiceType.QRCODE, "encode", log);
        call.logRequest(instanceUuid);

        try {
            BitMatrix matrix = writer.encode(instanceUuid, BarcodeFormat.QR_CODE, SIZE_PX, SIZE_PX,
                    Map.of(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name(),
                            EncodeHintType.MARGIN, 1));
            MatrixToImageWriter.writeToPath(matrix, "PNG", destination);
        } catch (WriterException | IOException e) {
            call.logError(e.getMessage(), e);
            throw new BuildWorkspaceException("QR code could not be written", destination, e);
        }

        call.logResponse(destination.toString());
        return destination;
    }
}
