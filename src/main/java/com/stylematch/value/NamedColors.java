package com.stylematch.value;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Named color table (CSS color keywords).
 */
public final class NamedColors {

    private NamedColors() {
    }

    private static final Map<String, Color> COLORS = Map.ofEntries(
            Map.entry("aliceblue", Color.rgb(0xf0f8ff)),
            Map.entry("antiquewhite", Color.rgb(0xfaebd7)),
            Map.entry("aqua", Color.rgb(0x00ffff)),
            Map.entry("aquamarine", Color.rgb(0x7fffd4)),
            Map.entry("azure", Color.rgb(0xf0ffff)),
            Map.entry("beige", Color.rgb(0xf5f5dc)),
            Map.entry("bisque", Color.rgb(0xffe4c4)),
            Map.entry("black", Color.rgb(0x000000)),
            Map.entry("blanchedalmond", Color.rgb(0xffebcd)),
            Map.entry("blue", Color.rgb(0x0000ff)),
            Map.entry("blueviolet", Color.rgb(0x8a2be2)),
            Map.entry("brown", Color.rgb(0xa52a2a)),
            Map.entry("burlywood", Color.rgb(0xdeb887)),
            Map.entry("cadetblue", Color.rgb(0x5f9ea0)),
            Map.entry("chartreuse", Color.rgb(0x7fff00)),
            Map.entry("chocolate", Color.rgb(0xd2691e)),
            Map.entry("coral", Color.rgb(0xff7f50)),
            Map.entry("cornflowerblue", Color.rgb(0x6495ed)),
            Map.entry("cornsilk", Color.rgb(0xfff8dc)),
            Map.entry("crimson", Color.rgb(0xdc143c)),
            Map.entry("cyan", Color.rgb(0x00ffff)),
            Map.entry("darkblue", Color.rgb(0x00008b)),
            Map.entry("darkcyan", Color.rgb(0x008b8b)),
            Map.entry("darkgoldenrod", Color.rgb(0xb8860b)),
            Map.entry("darkgray", Color.rgb(0xa9a9a9)),
            Map.entry("darkgreen", Color.rgb(0x006400)),
            Map.entry("darkgrey", Color.rgb(0xa9a9a9)),
            Map.entry("darkkhaki", Color.rgb(0xbdb76b)),
            Map.entry("darkmagenta", Color.rgb(0x8b008b)),
            Map.entry("darkolivegreen", Color.rgb(0x556b2f)),
            Map.entry("darkorange", Color.rgb(0xff8c00)),
            Map.entry("darkorchid", Color.rgb(0x9932cc)),
            Map.entry("darkred", Color.rgb(0x8b0000)),
            Map.entry("darksalmon", Color.rgb(0xe9967a)),
            Map.entry("darkseagreen", Color.rgb(0x8fbc8f)),
            Map.entry("darkslateblue", Color.rgb(0x483d8b)),
            Map.entry("darkslategray", Color.rgb(0x2f4f4f)),
            Map.entry("darkslategrey", Color.rgb(0x2f4f4f)),
            Map.entry("darkturquoise", Color.rgb(0x00ced1)),
            Map.entry("darkviolet", Color.rgb(0x9400d3)),
            Map.entry("deeppink", Color.rgb(0xff1493)),
            Map.entry("deepskyblue", Color.rgb(0x00bfff)),
            Map.entry("dimgray", Color.rgb(0x696969)),
            Map.entry("dimgrey", Color.rgb(0x696969)),
            Map.entry("dodgerblue", Color.rgb(0x1e90ff)),
            Map.entry("firebrick", Color.rgb(0xb22222)),
            Map.entry("floralwhite", Color.rgb(0xfffaf0)),
            Map.entry("forestgreen", Color.rgb(0x228b22)),
            Map.entry("fuchsia", Color.rgb(0xff00ff)),
            Map.entry("gainsboro", Color.rgb(0xdcdcdc)),
            Map.entry("ghostwhite", Color.rgb(0xf8f8ff)),
            Map.entry("gold", Color.rgb(0xffd700)),
            Map.entry("goldenrod", Color.rgb(0xdaa520)),
            Map.entry("gray", Color.rgb(0x808080)),
            Map.entry("green", Color.rgb(0x008000)),
            Map.entry("greenyellow", Color.rgb(0xadff2f)),
            Map.entry("grey", Color.rgb(0x808080)),
            Map.entry("honeydew", Color.rgb(0xf0fff0)),
            Map.entry("hotpink", Color.rgb(0xff69b4)),
            Map.entry("indianred", Color.rgb(0xcd5c5c)),
            Map.entry("indigo", Color.rgb(0x4b0082)),
            Map.entry("ivory", Color.rgb(0xfffff0)),
            Map.entry("khaki", Color.rgb(0xf0e68c)),
            Map.entry("lavender", Color.rgb(0xe6e6fa)),
            Map.entry("lavenderblush", Color.rgb(0xfff0f5)),
            Map.entry("lawngreen", Color.rgb(0x7cfc00)),
            Map.entry("lemonchiffon", Color.rgb(0xfffacd)),
            Map.entry("lightblue", Color.rgb(0xadd8e6)),
            Map.entry("lightcoral", Color.rgb(0xf08080)),
            Map.entry("lightcyan", Color.rgb(0xe0ffff)),
            Map.entry("lightgoldenrodyellow", Color.rgb(0xfafad2)),
            Map.entry("lightgray", Color.rgb(0xd3d3d3)),
            Map.entry("lightgreen", Color.rgb(0x90ee90)),
            Map.entry("lightgrey", Color.rgb(0xd3d3d3)),
            Map.entry("lightpink", Color.rgb(0xffb6c1)),
            Map.entry("lightsalmon", Color.rgb(0xffa07a)),
            Map.entry("lightseagreen", Color.rgb(0x20b2aa)),
            Map.entry("lightskyblue", Color.rgb(0x87cefa)),
            Map.entry("lightslategray", Color.rgb(0x778899)),
            Map.entry("lightslategrey", Color.rgb(0x778899)),
            Map.entry("lightsteelblue", Color.rgb(0xb0c4de)),
            Map.entry("lightyellow", Color.rgb(0xffffe0)),
            Map.entry("lime", Color.rgb(0x00ff00)),
            Map.entry("limegreen", Color.rgb(0x32cd32)),
            Map.entry("linen", Color.rgb(0xfaf0e6)),
            Map.entry("magenta", Color.rgb(0xff00ff)),
            Map.entry("maroon", Color.rgb(0x800000)),
            Map.entry("mediumaquamarine", Color.rgb(0x66cdaa)),
            Map.entry("mediumblue", Color.rgb(0x0000cd)),
            Map.entry("mediumorchid", Color.rgb(0xba55d3)),
            Map.entry("mediumpurple", Color.rgb(0x9370db)),
            Map.entry("mediumseagreen", Color.rgb(0x3cb371)),
            Map.entry("mediumslateblue", Color.rgb(0x7b68ee)),
            Map.entry("mediumspringgreen", Color.rgb(0x00fa9a)),
            Map.entry("mediumturquoise", Color.rgb(0x48d1cc)),
            Map.entry("mediumvioletred", Color.rgb(0xc71585)),
            Map.entry("midnightblue", Color.rgb(0x191970)),
            Map.entry("mintcream", Color.rgb(0xf5fffa)),
            Map.entry("mistyrose", Color.rgb(0xffe4e1)),
            Map.entry("moccasin", Color.rgb(0xffe4b5)),
            Map.entry("navajowhite", Color.rgb(0xffdead)),
            Map.entry("navy", Color.rgb(0x000080)),
            Map.entry("oldlace", Color.rgb(0xfdf5e6)),
            Map.entry("olive", Color.rgb(0x808000)),
            Map.entry("olivedrab", Color.rgb(0x6b8e23)),
            Map.entry("orange", Color.rgb(0xffa500)),
            Map.entry("orangered", Color.rgb(0xff4500)),
            Map.entry("orchid", Color.rgb(0xda70d6)),
            Map.entry("palegoldenrod", Color.rgb(0xeee8aa)),
            Map.entry("palegreen", Color.rgb(0x98fb98)),
            Map.entry("paleturquoise", Color.rgb(0xafeeee)),
            Map.entry("palevioletred", Color.rgb(0xdb7093)),
            Map.entry("papayawhip", Color.rgb(0xffefd5)),
            Map.entry("peachpuff", Color.rgb(0xffdab9)),
            Map.entry("peru", Color.rgb(0xcd853f)),
            Map.entry("pink", Color.rgb(0xffc0cb)),
            Map.entry("plum", Color.rgb(0xdda0dd)),
            Map.entry("powderblue", Color.rgb(0xb0e0e6)),
            Map.entry("purple", Color.rgb(0x800080)),
            Map.entry("rebeccapurple", Color.rgb(0x663399)),
            Map.entry("red", Color.rgb(0xff0000)),
            Map.entry("rosybrown", Color.rgb(0xbc8f8f)),
            Map.entry("royalblue", Color.rgb(0x4169e1)),
            Map.entry("saddlebrown", Color.rgb(0x8b4513)),
            Map.entry("salmon", Color.rgb(0xfa8072)),
            Map.entry("sandybrown", Color.rgb(0xf4a460)),
            Map.entry("seagreen", Color.rgb(0x2e8b57)),
            Map.entry("seashell", Color.rgb(0xfff5ee)),
            Map.entry("sienna", Color.rgb(0xa0522d)),
            Map.entry("silver", Color.rgb(0xc0c0c0)),
            Map.entry("skyblue", Color.rgb(0x87ceeb)),
            Map.entry("slateblue", Color.rgb(0x6a5acd)),
            Map.entry("slategray", Color.rgb(0x708090)),
            Map.entry("slategrey", Color.rgb(0x708090)),
            Map.entry("snow", Color.rgb(0xfffafa)),
            Map.entry("springgreen", Color.rgb(0x00ff7f)),
            Map.entry("steelblue", Color.rgb(0x4682b4)),
            Map.entry("tan", Color.rgb(0xd2b48c)),
            Map.entry("teal", Color.rgb(0x008080)),
            Map.entry("thistle", Color.rgb(0xd8bfd8)),
            Map.entry("tomato", Color.rgb(0xff6347)),
            Map.entry("turquoise", Color.rgb(0x40e0d0)),
            Map.entry("violet", Color.rgb(0xee82ee)),
            Map.entry("wheat", Color.rgb(0xf5deb3)),
            Map.entry("white", Color.rgb(0xffffff)),
            Map.entry("whitesmoke", Color.rgb(0xf5f5f5)),
            Map.entry("yellow", Color.rgb(0xffff00)),
            Map.entry("yellowgreen", Color.rgb(0x9acd32)),
            Map.entry("transparent", new Color(0, 0, 0, 0f))
    );

    /**
     * Look up a named color, ignoring case.
     *
     * @param name Color name (e.g., "rebeccapurple")
     * @return The color, or empty if the name is not a known color
     */
    public static Optional<Color> tryGetNamedColor(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(COLORS.get(name.toLowerCase(Locale.ROOT)));
    }
}
