package com.flamingo.ai.pdftools.acquisition;

import com.flamingo.ai.pdftools.exception.InvalidDocumentException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;

/** Loading and saving of in-memory PDFs with consistent error mapping. */
public final class PdfDocuments {

  public static final String ENCRYPTED_MESSAGE = "PDF encrypted. Use Unlock tool first.";

  private PdfDocuments() {}

  /**
   * Opens a PDF, decrypting it with the empty user password if it is encrypted.
   *
   * @throws InvalidDocumentException if the bytes are not a readable PDF or a password is needed
   */
  public static PDDocument open(SourceDocument document) {
    try {
      return Loader.loadPDF(document.bytes());
    } catch (InvalidPasswordException e) {
      throw new InvalidDocumentException(
          "Password required for " + document.fileName(), ENCRYPTED_MESSAGE, e);
    } catch (IOException e) {
      throw notReadable(document, e);
    }
  }

  /**
   * Opens a PDF with the given password.
   *
   * @throws InvalidPasswordException if the password does not open the document
   * @throws InvalidDocumentException if the bytes are not a readable PDF
   */
  public static PDDocument open(SourceDocument document, String password)
      throws InvalidPasswordException {
    try {
      return Loader.loadPDF(document.bytes(), password == null ? "" : password);
    } catch (InvalidPasswordException e) {
      throw e;
    } catch (IOException e) {
      throw notReadable(document, e);
    }
  }

  public static byte[] save(PDDocument pdf) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    pdf.save(out);
    return out.toByteArray();
  }

  private static InvalidDocumentException notReadable(SourceDocument document, IOException e) {
    return new InvalidDocumentException(
        "Cannot open " + document.fileName() + " as PDF: " + e.getMessage(),
        "Unable to open PDF.",
        e);
  }
}
