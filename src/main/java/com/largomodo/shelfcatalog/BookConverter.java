package com.largomodo.shelfcatalog;

import com.largomodo.shelfcatalog.core.domain.Book;
import com.largomodo.shelfcatalog.util.BookSpecParser;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Picocli converter for {@code --book} values. Parse failures surface as usage errors (exit code 2).
 */
public class BookConverter implements ITypeConverter<Book> {

    @Override
    public Book convert(String value) {
        try {
            return BookSpecParser.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
