package cafe.woden.talkalert.ui.tray;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import javax.imageio.ImageIO;

/**
 * Programmatic tray icon: a white chat bubble with a green "live" dot.
 *
 * <p>Drawn at 64px and left to the tray to scale.
 */
public final class TrayIconFactory {

  static final Color LIVE_GREEN = new Color(0x2ECC71);

  private TrayIconFactory() {}

  public static BufferedImage createTrayImage() {
    int size = 64;
    BufferedImage img = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = img.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);

      g.setColor(Color.WHITE);
      g.fillRoundRect(8, 12, 48, 36, 14, 14);
      g.fillPolygon(new int[] {18, 30, 18}, new int[] {46, 46, 58}, 3);

      g.setColor(new Color(0xB4B4B4));
      g.setStroke(new BasicStroke(2f));
      g.drawRoundRect(8, 12, 48, 36, 14, 14);

      // Message lines
      g.setColor(new Color(0xDCDCDC));
      g.fillRoundRect(18, 22, 26, 12, 7, 7);
      g.setColor(new Color(0xC8C8C8));
      g.fillRoundRect(22, 36, 26, 8, 7, 7);

      g.setColor(LIVE_GREEN);
      g.fillOval(40, 18, 10, 10);
    } finally {
      g.dispose();
    }
    return img;
  }

  static InputStream createTrayIconPngStream() {
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream(8 * 1024);
      ImageIO.write(createTrayImage(), "png", out);
      return new ByteArrayInputStream(out.toByteArray());
    } catch (IOException e) {
      return new ByteArrayInputStream(new byte[0]);
    }
  }
}
