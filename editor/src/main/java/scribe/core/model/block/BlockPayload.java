package scribe.core.model.block;

import java.util.List;

/**
 * Type-specific content of a block.
 *
 * <p>One record per {@link BlockType}. Composite payloads additionally carry
 * child rows that are persisted together with the parent block.
 */
public sealed interface BlockPayload
        permits BlockPayload.Text,
                BlockPayload.Images,
                BlockPayload.Video,
                BlockPayload.Quote,
                BlockPayload.Callout,
                BlockPayload.Code,
                BlockPayload.Table,
                BlockPayload.Twitter,
                BlockPayload.Instagram,
                BlockPayload.Chart,
                BlockPayload.Poll,
                BlockPayload.Heading,
                BlockPayload.ItemList {

    BlockType type();

    /**
     * Payload owning embedded child rows.
     *
     * @param <C> child row type
     */
    interface Composite<C extends ChildRow<C>> {

        List<C> children();

        BlockPayload withChildren(List<C> children);
    }

    record Text(String text, boolean hasDropCap) implements BlockPayload {

        public Text {
            text = text == null ? "" : text;
        }

        @Override
        public BlockType type() {
            return BlockType.TEXT;
        }
    }

    record Images(String caption, List<GalleryImage> images) implements BlockPayload, Composite<GalleryImage> {

        public Images {
            images = images == null ? List.of() : List.copyOf(images);
        }

        @Override
        public BlockType type() {
            return BlockType.IMAGES;
        }

        @Override
        public List<GalleryImage> children() {
            return images;
        }

        @Override
        public Images withChildren(List<GalleryImage> children) {
            return new Images(caption, children);
        }
    }

    record Video(String alt, String caption, String videoFileId, String posterFileId) implements BlockPayload {

        @Override
        public BlockType type() {
            return BlockType.VIDEO;
        }
    }

    record Quote(String quote, String author, String source) implements BlockPayload {

        public Quote {
            quote = quote == null ? "" : quote;
        }

        @Override
        public BlockType type() {
            return BlockType.QUOTE;
        }
    }

    record Callout(CalloutKind kind, String title, String content) implements BlockPayload {

        public Callout {
            kind = kind == null ? CalloutKind.INFO : kind;
            content = content == null ? "" : content;
        }

        @Override
        public BlockType type() {
            return BlockType.CALLOUT;
        }
    }

    record Code(
            String codeText,
            String language,
            boolean showLineNumbers,
            String title,
            Integer maxHeight,
            Integer startLine,
            List<Integer> highlightLines)
            implements BlockPayload {

        public Code {
            codeText = codeText == null ? "" : codeText;
            highlightLines = highlightLines == null ? List.of() : List.copyOf(highlightLines);
        }

        @Override
        public BlockType type() {
            return BlockType.CODE;
        }
    }

    record Table(String caption, String description, TableMobileLayout mobileLayout, String fileId)
            implements BlockPayload {

        public Table {
            mobileLayout = mobileLayout == null ? TableMobileLayout.SCROLL : mobileLayout;
        }

        @Override
        public BlockType type() {
            return BlockType.TABLE;
        }
    }

    record Twitter(
            String username,
            String handle,
            String content,
            String date,
            int likes,
            int retweets,
            int replies,
            boolean verified,
            String imageFileId)
            implements BlockPayload {

        public Twitter {
            content = content == null ? "" : content;
        }

        @Override
        public BlockType type() {
            return BlockType.TWITTER;
        }
    }

    record Instagram(
            String username,
            String avatar,
            String location,
            String date,
            String instagramId,
            int likes,
            int comments,
            String caption,
            boolean verified,
            List<InstagramFile> files)
            implements BlockPayload, Composite<InstagramFile> {

        public Instagram {
            files = files == null ? List.of() : List.copyOf(files);
        }

        @Override
        public BlockType type() {
            return BlockType.INSTAGRAM;
        }

        @Override
        public List<InstagramFile> children() {
            return files;
        }

        @Override
        public Instagram withChildren(List<InstagramFile> children) {
            return new Instagram(
                    username, avatar, location, date, instagramId, likes, comments, caption, verified, children);
        }
    }

    record Chart(
            ChartType chartType,
            String title,
            String description,
            boolean showGrid,
            boolean showLegend,
            boolean showFooter,
            boolean stacked,
            String fileId,
            String xAxis,
            String yAxis,
            List<String> series)
            implements BlockPayload {

        public Chart {
            chartType = chartType == null ? ChartType.BAR : chartType;
            series = series == null ? List.of() : List.copyOf(series);
        }

        @Override
        public BlockType type() {
            return BlockType.CHART;
        }
    }

    record Poll(String title, String description, List<PollOption> options)
            implements BlockPayload, Composite<PollOption> {

        public Poll {
            options = options == null ? List.of() : List.copyOf(options);
        }

        @Override
        public BlockType type() {
            return BlockType.POLL;
        }

        @Override
        public List<PollOption> children() {
            return options;
        }

        @Override
        public Poll withChildren(List<PollOption> children) {
            return new Poll(title, description, children);
        }
    }

    record Heading(HeadingLevel level, String heading) implements BlockPayload {

        public Heading {
            level = level == null ? HeadingLevel.H2 : level;
            heading = heading == null ? "" : heading;
        }

        @Override
        public BlockType type() {
            return BlockType.HEADING;
        }
    }

    record ItemList(ListType listType, List<ListItem> items) implements BlockPayload, Composite<ListItem> {

        public ItemList {
            listType = listType == null ? ListType.BULLET : listType;
            items = items == null ? List.of() : List.copyOf(items);
        }

        @Override
        public BlockType type() {
            return BlockType.LIST;
        }

        @Override
        public List<ListItem> children() {
            return items;
        }

        @Override
        public ItemList withChildren(List<ListItem> children) {
            return new ItemList(listType, children);
        }
    }
}
