package io.physpage;

public interface PagingChoicesAdapter {
    String INSTRUCTION_PAGE_ALIASING = "Instruction Page Aliasing";
    String DATA_PAGE_ALIASING = "Data Page Aliasing";

    int getPlainPagingChoice(String name);
}
