package org.ansi4j.sauce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Decoded SAUCE 00 record. Text fields hold Unicode strings; numeric fields hold the
 * unsigned values from the record.
 */
public final class SauceRecord {

    public static final int TITLE_LENGTH = 35;
    public static final int AUTHOR_LENGTH = 20;
    public static final int GROUP_LENGTH = 20;
    public static final int DATE_LENGTH = 8;
    public static final int TINFOS_LENGTH = 22;
    public static final int COMMENT_LINE_LENGTH = 64;
    public static final int MAX_COMMENT_LINES = 255;

    private final String title;
    private final String author;
    private final String group;
    private final String date;
    private final long fileSize;
    private final int dataType;
    private final int fileType;
    private final int tinfo1;
    private final int tinfo2;
    private final int tinfo3;
    private final int tinfo4;
    private final int tflags;
    private final String tinfos;
    private final List<String> comments;

    private SauceRecord(Builder b) {
        this.title = b.title;
        this.author = b.author;
        this.group = b.group;
        this.date = b.date;
        this.fileSize = b.fileSize;
        this.dataType = b.dataType;
        this.fileType = b.fileType;
        this.tinfo1 = b.tinfo1;
        this.tinfo2 = b.tinfo2;
        this.tinfo3 = b.tinfo3;
        this.tinfo4 = b.tinfo4;
        this.tflags = b.tflags;
        this.tinfos = b.tinfos;
        this.comments = Collections.unmodifiableList(new ArrayList<>(b.comments));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .title(title)
            .author(author)
            .group(group)
            .date(date)
            .fileSize(fileSize)
            .dataType(dataType)
            .fileType(fileType)
            .tinfo1(tinfo1)
            .tinfo2(tinfo2)
            .tinfo3(tinfo3)
            .tinfo4(tinfo4)
            .tflags(tflags)
            .tinfos(tinfos)
            .comments(comments);
    }

    public String getTitle() {
        return title;
    }

    public String getAuthor() {
        return author;
    }

    public String getGroup() {
        return group;
    }

    /** CCYYMMDD, or empty. */
    public String getDate() {
        return date;
    }

    public long getFileSize() {
        return fileSize;
    }

    public int getDataType() {
        return dataType;
    }

    public SauceDataType getDataTypeKind() {
        return SauceDataType.fromCode(dataType);
    }

    public int getFileType() {
        return fileType;
    }

    /** Width in characters for character and XBin data. */
    public int getTinfo1() {
        return tinfo1;
    }

    /** Height in lines for character and XBin data. */
    public int getTinfo2() {
        return tinfo2;
    }

    public int getTinfo3() {
        return tinfo3;
    }

    public int getTinfo4() {
        return tinfo4;
    }

    public int getTflags() {
        return tflags;
    }

    /** Declared font name for character data. */
    public String getTinfos() {
        return tinfos;
    }

    public List<String> getComments() {
        return comments;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SauceRecord)) return false;
        SauceRecord that = (SauceRecord) o;
        return fileSize == that.fileSize && dataType == that.dataType && fileType == that.fileType
            && tinfo1 == that.tinfo1 && tinfo2 == that.tinfo2 && tinfo3 == that.tinfo3 && tinfo4 == that.tinfo4
            && tflags == that.tflags && title.equals(that.title) && author.equals(that.author)
            && group.equals(that.group) && date.equals(that.date) && tinfos.equals(that.tinfos)
            && comments.equals(that.comments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, author, group, date, fileSize, dataType, fileType,
            tinfo1, tinfo2, tinfo3, tinfo4, tflags, tinfos, comments);
    }

    @Override
    public String toString() {
        return "SauceRecord{title='" + title + "', author='" + author + "', group='" + group
            + "', dataType=" + dataType + ", fileType=" + fileType + ", tinfo1=" + tinfo1
            + ", tinfo2=" + tinfo2 + ", tinfos='" + tinfos + "', comments=" + comments.size() + "}";
    }

    public static final class Builder {
        private String title = "";
        private String author = "";
        private String group = "";
        private String date = "";
        private long fileSize;
        private int dataType = SauceDataType.CHARACTER.code();
        private int fileType = 1;
        private int tinfo1;
        private int tinfo2;
        private int tinfo3;
        private int tinfo4;
        private int tflags;
        private String tinfos = "";
        private List<String> comments = new ArrayList<>();

        private Builder() {
        }

        public Builder title(String title) {
            this.title = Objects.requireNonNull(title, "title");
            return this;
        }

        public Builder author(String author) {
            this.author = Objects.requireNonNull(author, "author");
            return this;
        }

        public Builder group(String group) {
            this.group = Objects.requireNonNull(group, "group");
            return this;
        }

        public Builder date(String date) {
            this.date = Objects.requireNonNull(date, "date");
            return this;
        }

        public Builder fileSize(long fileSize) {
            this.fileSize = fileSize & 0xFFFFFFFFL;
            return this;
        }

        public Builder dataType(int dataType) {
            this.dataType = dataType & 0xFF;
            return this;
        }

        public Builder dataType(SauceDataType dataType) {
            return dataType(dataType.code());
        }

        public Builder fileType(int fileType) {
            this.fileType = fileType & 0xFF;
            return this;
        }

        public Builder tinfo1(int v) {
            this.tinfo1 = v & 0xFFFF;
            return this;
        }

        public Builder tinfo2(int v) {
            this.tinfo2 = v & 0xFFFF;
            return this;
        }

        public Builder tinfo3(int v) {
            this.tinfo3 = v & 0xFFFF;
            return this;
        }

        public Builder tinfo4(int v) {
            this.tinfo4 = v & 0xFFFF;
            return this;
        }

        public Builder tflags(int tflags) {
            this.tflags = tflags & 0xFF;
            return this;
        }

        public Builder tinfos(String tinfos) {
            this.tinfos = Objects.requireNonNull(tinfos, "tinfos");
            return this;
        }

        public Builder comments(List<String> comments) {
            this.comments = new ArrayList<>(Objects.requireNonNull(comments, "comments"));
            return this;
        }

        public SauceRecord build() {
            return new SauceRecord(this);
        }
    }
}
